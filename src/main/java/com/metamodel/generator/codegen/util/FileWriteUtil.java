package com.metamodel.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes lines to a file, each followed by a newline, creating parent directories if needed.
     * The content goes to a sibling temporary file first and is then moved into place, so the
     * target never holds partial output.
     */
    public static void safeWriteLines(Path filePath, List<String> lines) throws IOException {
        Path absolute = filePath.toAbsolutePath();
        Path parentDir = absolute.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Path temp = Files.createTempFile(parentDir, absolute.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, joinLines(lines), StandardCharsets.UTF_8);
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Joins lines, terminating each with a newline.
     */
    public static String joinLines(List<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
