package com.appspec.generator.codegen.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility for file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes bytes to a file, creating parent directories if needed.
     */
    public static void safeWriteBytes(Path filePath, byte[] content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.write(filePath, content);
    }

    /**
     * Deletes the given files below {@code root} together with the directories they leave
     * empty. Returns the number of files deleted.
     */
    public static int deleteFiles(Path root, List<String> relativePaths) throws IOException {
        int deleted = 0;
        for (String relative : relativePaths) {
            Path file = root.resolve(relative).normalize();
            if (Files.deleteIfExists(file)) {
                deleted++;
                deleteEmptyParents(root, file.getParent());
            }
        }
        return deleted;
    }

    private static void deleteEmptyParents(Path root, Path dir) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(root) && current.startsWith(root)) {
            try (Stream<Path> entries = Files.list(current)) {
                if (entries.findAny().isPresent()) {
                    return;
                }
            }
            Files.delete(current);
            current = current.getParent();
        }
    }
}
