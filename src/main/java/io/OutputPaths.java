package io;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Naming rules for everything the tool writes. */
public final class OutputPaths {
    private OutputPaths() {
    }

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    /** Removes one pair of surrounding double quotes, as pasted from a file manager. */
    public static String unquote(String raw) {
        String s = raw.trim();
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            s = s.substring(1, s.length() - 1);
        }
        return s;
    }

    public static Path withPngExtension(Path out) {
        String name = out.getFileName().toString();
        if (name.toLowerCase(Locale.ROOT).endsWith(".png")) {
            return out;
        }
        return out.resolveSibling(name + ".png");
    }

    public static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }

    /** {@code {baseName}_split_{yyyyMMdd_HHmmss}} under {@code parent}. */
    public static Path splitDirectory(Path parent, Path source, LocalDateTime now) {
        return parent.resolve(baseName(source) + "_split_" + STAMP.format(now));
    }
}
