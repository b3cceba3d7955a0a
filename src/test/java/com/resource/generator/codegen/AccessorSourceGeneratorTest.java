package com.resource.generator.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.resource.generator.model.Selector;
import com.resource.generator.model.SuffixOption;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AccessorSourceGenerator.
 */
class AccessorSourceGeneratorTest {

    @TempDir
    Path tempDir;

    private final AccessorSourceGenerator generator = new AccessorSourceGenerator();

    @Test
    void testGeneratesReadWriteFacade() throws IOException {
        GeneratorConfig config = GeneratorConfig.builder()
                .schemaClassName("com.example.blog.BlogPost")
                .selector(Selector.readWrite())
                .outputDir(tempDir)
                .build();

        GeneratorResult result = generator.generate(config);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isWritten()).isTrue();
        assertThat(result.getSuffix()).isEqualTo("blog_post");
        assertThat(result.getAccessorCount()).isEqualTo(10);
        assertThat(result.getDescriptions()).contains("all_blog_posts/1", "get_blog_post_by!/2", "change_blog_post/1");

        Path facade = tempDir.resolve("com/example/blog/BlogPostAccessors.java");
        assertThat(result.getOutputPath()).isEqualTo(facade);
        assertThat(facade).exists();

        String source = Files.readString(facade);
        assertThat(source)
                .contains("package com.example.blog;")
                .contains("import java.util.List;")
                .contains("import java.util.Optional;")
                .contains("import com.resource.generator.binding.WriteResult;")
                .contains("import com.resource.generator.binding.Changeset;")
                .doesNotContain("import com.example.blog.BlogPost;")
                .contains("public class BlogPostAccessors {")
                .contains("public List<BlogPost> allBlogPosts(Map<String, Object> options) {")
                .contains("return accessor.all(options);")
                .contains("public Optional<BlogPost> getBlogPostBy(Map<String, Object> clauses, Map<String, Object> options) {")
                .contains("public BlogPost getBlogPostByOrThrow(Map<String, Object> clauses, Map<String, Object> options) {")
                .contains("return accessor.getByOrThrow(clauses, options);")
                .contains("public WriteResult<BlogPost> updateBlogPost(BlogPost resource, Map<String, Object> attributes) {")
                .contains("public BlogPost createBlogPostOrThrow(Map<String, Object> attributes) {")
                .contains("{@code create_blog_post!/1}")
                .doesNotContain("deleteBlogPost");
    }

    @Test
    void testFacadeInOtherPackageImportsSchema() {
        GeneratorConfig config = GeneratorConfig.builder()
                .schemaClassName("com.example.User")
                .targetPackage("com.example.accessors")
                .selector(Selector.only("delete!"))
                .outputDir(tempDir)
                .build();

        GeneratorResult result = generator.generate(config);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutputPath()).isEqualTo(tempDir.resolve("com/example/accessors/UserAccessors.java"));
        assertThat(result.getSource())
                .contains("package com.example.accessors;")
                .contains("import com.example.User;")
                .contains("public User deleteUserOrThrow(User resource) {")
                .doesNotContain("import java.util.Optional;")
                .doesNotContain("import java.util.List;");
    }

    @Test
    void testUnsuffixedFacadeUsesBareNames() {
        GeneratorConfig config = GeneratorConfig.builder()
                .schemaClassName("com.example.User")
                .suffixOption(SuffixOption.DISABLED)
                .dryRun(true)
                .outputDir(tempDir)
                .build();

        GeneratorResult result = generator.generate(config);

        assertThat(result.getSuffix()).isEmpty();
        assertThat(result.getDescriptions()).contains("all/1", "get_by!/2");
        assertThat(result.getSource())
                .contains("public List<User> all(Map<String, Object> options) {")
                .contains("public User getByOrThrow(Map<String, Object> clauses, Map<String, Object> options) {")
                .contains("public Changeset<User> change(User resource) {");
    }

    @Test
    void testDryRunWritesNothing() {
        GeneratorConfig config = GeneratorConfig.builder()
                .schemaClassName("com.example.User")
                .dryRun(true)
                .outputDir(tempDir)
                .build();

        GeneratorResult result = generator.generate(config);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isWritten()).isFalse();
        assertThat(result.getAccessorCount()).isEqualTo(12);
        assertThat(tempDir.resolve("com/example/UserAccessors.java")).doesNotExist();
    }

    @Test
    void testExistingFileNeedsForce() throws IOException {
        Path existing = tempDir.resolve("com/example/UserAccessors.java");
        Files.createDirectories(existing.getParent());
        Files.writeString(existing, "// hand written");

        GeneratorConfig config = GeneratorConfig.builder()
                .schemaClassName("com.example.User")
                .outputDir(tempDir)
                .build();

        GeneratorResult refused = generator.generate(config);
        assertThat(refused.isSuccess()).isFalse();
        assertThat(refused.getErrorMessage()).contains("already exists");
        assertThat(Files.readString(existing)).isEqualTo("// hand written");

        config.setForce(true);
        GeneratorResult forced = generator.generate(config);
        assertThat(forced.isSuccess()).isTrue();
        assertThat(Files.readString(existing)).contains("public class UserAccessors {");
    }

    @Test
    void testSelectorLeavingNothingFails() {
        GeneratorConfig config = GeneratorConfig.builder()
                .schemaClassName("com.example.User")
                .selector(Selector.only("upsert"))
                .outputDir(tempDir)
                .build();

        GeneratorResult result = generator.generate(config);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("leaves no accessors");
    }

    @Test
    void testDefaultPackageSchema() {
        GeneratorConfig config = GeneratorConfig.builder()
                .schemaClassName("Invoice")
                .selector(Selector.only("all"))
                .dryRun(true)
                .build();

        GeneratorResult result = generator.generate(config);

        assertThat(result.getOutputPath()).isEqualTo(Path.of("InvoiceAccessors.java"));
        assertThat(result.getSource())
                .doesNotContain("package ")
                .contains("public List<Invoice> allInvoices(Map<String, Object> options) {");
    }
}
