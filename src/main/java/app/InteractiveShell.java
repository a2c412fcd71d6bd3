package app;

import grid.GridSpec;
import io.ImageFiles;
import io.OutputPaths;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Prompt-driven front end used when the tool starts without arguments. Every answer is
 * re-asked until it is usable; end of input ends the session.
 */
final class InteractiveShell {

    private final Commands commands;
    private final BufferedReader br;
    private final PrintStream out;

    InteractiveShell(Commands commands, InputStream in, PrintStream out) {
        this.commands = commands;
        this.br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    int run() {
        out.println("=== Image Processing Program ===");
        out.println();
        out.println("Choose operation mode:");
        out.println("  1 - Split image into frames");
        out.println("  2 - Merge frames into one image");
        out.println();
        try {
            int mode = askMode();
            return mode == 1 ? splitSession() : mergeSession();
        } catch (EndOfInput e) {
            out.println();
            out.println("Input closed, nothing done.");
            return Commands.USAGE;
        } catch (IOException ioe) {
            System.err.println("Shell I/O error: " + ioe.getMessage());
            return Commands.FAILED;
        }
    }

    private int splitSession() throws IOException {
        Path image;
        while (true) {
            image = askPath("Enter path to image file: ");
            if (!Files.isRegularFile(image)) {
                out.println("File not found!");
            } else if (!ImageFiles.isSupported(image)) {
                out.println("Unsupported file format! Supported formats: PNG, JPG, JPEG, BMP");
            } else {
                break;
            }
        }
        GridSpec grid = new GridSpec(askPositive("Enter number of rows: "), askPositive("Enter number of columns: "));
        return commands.split(image, grid, null);
    }

    private int mergeSession() throws IOException {
        Path dir;
        while (true) {
            dir = askPath("Enter path to frames folder: ");
            if (Files.isDirectory(dir)) {
                break;
            }
            out.println("Folder not found!");
        }
        GridSpec grid = new GridSpec(askPositive("Enter number of rows: "), askPositive("Enter number of columns: "));
        Path output;
        while (true) {
            output = OutputPaths.withPngExtension(askPath("Enter path to save result (with .png extension): "));
            Path parent = output.toAbsolutePath().getParent();
            if (parent == null || Files.isDirectory(parent)) {
                break;
            }
            out.println("Folder does not exist!");
        }
        return commands.merge(dir, grid, output);
    }

    private int askMode() throws IOException {
        while (true) {
            String line = ask("Enter mode number (1 or 2): ");
            if (line.equals("1") || line.equals("2")) {
                return Integer.parseInt(line);
            }
            out.println("Please enter 1 or 2!");
        }
    }

    private int askPositive(String prompt) throws IOException {
        while (true) {
            String line = ask(prompt);
            if (line.matches("\\d{1,9}")) {
                int v = Integer.parseInt(line);
                if (v > 0) {
                    return v;
                }
            }
            out.println("Please enter a positive integer!");
        }
    }

    private Path askPath(String prompt) throws IOException {
        while (true) {
            String line = OutputPaths.unquote(ask(prompt));
            if (!line.isEmpty()) {
                return Paths.get(line);
            }
            out.println("Path cannot be empty!");
        }
    }

    private String ask(String prompt) throws IOException {
        out.print(prompt);
        out.flush();
        String line = br.readLine();
        if (line == null) {
            throw new EndOfInput();
        }
        return line.trim();
    }

    private static final class EndOfInput extends IOException {
        EndOfInput() {
            super("end of input");
        }
    }
}
