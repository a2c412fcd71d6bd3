package util;

import java.io.PrintStream;
import java.util.function.Consumer;

/**
 * Sinks for human-readable status text. Core components only ever see a
 * {@code Consumer<String>}; the CLI decides where the text goes.
 */
public final class Status {
    private Status() {
    }

    public static final Consumer<String> SILENT = line -> {
    };

    public static Consumer<String> console(PrintStream out) {
        return out::println;
    }

    /**
     * Progress counter written in place with a carriage return. Advisory only: nothing
     * downstream reads it back.
     */
    public static Consumer<String> progress(PrintStream out, boolean enabled) {
        if (!enabled) {
            return SILENT;
        }
        return line -> {
            out.print("\r" + line);
            out.flush();
        };
    }
}
