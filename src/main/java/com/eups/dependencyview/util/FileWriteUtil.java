package com.eups.dependencyview.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes rendered output to disk, creating parent directories if needed.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes {@code content} as UTF-8, replacing any existing file.
     */
    public static void writeUtf8(Path filePath, String content) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }
}
