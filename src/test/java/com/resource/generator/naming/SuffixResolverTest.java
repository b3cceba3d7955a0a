package com.resource.generator.naming;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.resource.generator.model.SuffixOption;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SuffixResolver and EnglishPluralizer.
 */
class SuffixResolverTest {

    @ParameterizedTest
    @CsvSource({
        "User,                        user",
        "BlogPost,                    blog_post",
        "com.example.blog.BlogPost,   blog_post",
        "com.example.Outer$LineItem,  line_item",
        "HTTPRequest,                 http_request",
        "OAuthToken,                  o_auth_token"
    })
    void testComputesSnakeSuffix(String schema, String expected) {
        assertThat(SuffixResolver.computeSuffix(schema, SuffixOption.ENABLED)).isEqualTo(expected);
    }

    @Test
    void testDisabledSuffixIsEmpty() {
        assertThat(SuffixResolver.computeSuffix("com.example.BlogPost", SuffixOption.DISABLED)).isEmpty();
        assertThat(SuffixResolver.computeSuffix(SuffixResolverTest.class, SuffixOption.DISABLED)).isEmpty();
    }

    @Test
    void testSuffixFromClass() {
        assertThat(SuffixResolver.computeSuffix(SuffixResolverTest.class, SuffixOption.ENABLED))
                .isEqualTo("suffix_resolver_test");
    }

    @Test
    void testBlankSchemaIsRejected() {
        assertThatThrownBy(() -> SuffixResolver.computeSuffix(" ", SuffixOption.ENABLED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = { "com.example.", "com.example.Outer$" })
    void testIdentifierWithoutSimpleNameIsRejected(String schema) {
        assertThatThrownBy(() -> SuffixResolver.computeSuffix(schema, SuffixOption.ENABLED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(schema);
    }

    @Test
    void testAnonymousClassIsRejected() {
        Class<?> anonymous = new Object() { }.getClass();

        assertThatThrownBy(() -> SuffixResolver.computeSuffix(anonymous, SuffixOption.ENABLED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no simple name");
        assertThat(SuffixResolver.computeSuffix(anonymous, SuffixOption.DISABLED)).isEmpty();
    }

    @Test
    void testNullClassIsRejected() {
        assertThatThrownBy(() -> SuffixResolver.computeSuffix((Class<?>) null, SuffixOption.ENABLED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @CsvSource({
        "suffix,    suffixes",
        "user,      users",
        "category,  categories",
        "blog_post, blog_posts"
    })
    void testEnglishPluralizer(String singular, String plural) {
        assertThat(new EnglishPluralizer().pluralize(singular)).isEqualTo(plural);
    }
}
