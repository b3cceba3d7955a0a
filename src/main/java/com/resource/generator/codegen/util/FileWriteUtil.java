package com.resource.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.resource.generator.codegen.model.output.GeneratedFile;

/**
 * Utility for writing generated files with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Writes a generated file below the given root.
     */
    public static Path write(Path root, GeneratedFile file) throws IOException {
        Path target = root.resolve(file.getPath());
        safeWriteString(target, file.getContents());
        return target;
    }
}
