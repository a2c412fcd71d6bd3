package io;

import error.PathException;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Finds the image files a merge consumes. */
public final class ImageFiles {
    private ImageFiles() {
    }

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg", ".bmp");

    public static boolean isSupported(Path file) {
        return SUPPORTED_EXTENSIONS.contains(extension(file));
    }

    /** Lower-cased extension including the dot, or "" when the name has none. */
    public static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /** Supported images directly inside {@code dir}, sorted by file name. */
    public static List<Path> list(Path dir) {
        if (!Files.isDirectory(dir)) {
            throw new PathException("Folder not found: " + dir);
        }
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile)
                    .filter(ImageFiles::isSupported)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (AccessDeniedException e) {
            throw new PathException("No access to folder " + dir, e);
        } catch (IOException e) {
            throw new PathException("Could not list folder " + dir + ": " + e.getMessage(), e);
        }
    }
}
