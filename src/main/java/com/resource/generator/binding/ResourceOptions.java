package com.resource.generator.binding;

import com.resource.generator.model.Selector;
import com.resource.generator.model.SuffixOption;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Per-resource options: whether names are suffixed and which operations exist.
 */
@Value
@Builder(toBuilder = true)
public class ResourceOptions {

    @NonNull
    @Builder.Default
    SuffixOption suffixOption = SuffixOption.ENABLED;

    @NonNull
    @Builder.Default
    Selector selector = Selector.all();

    public static ResourceOptions defaults() {
        return ResourceOptions.builder().build();
    }
}
