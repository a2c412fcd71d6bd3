package app;

import error.GridImageException;
import grid.GridSpec;
import io.ImageFiles;
import io.ImageLoader;
import pipeline.MergePipeline;
import pipeline.MergeResult;
import pipeline.SplitPipeline;
import pipeline.SplitResult;
import util.Status;
import util.Timing;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs one split or merge against the console. Shared by the argument-driven and the
 * interactive front ends so both print the same status lines.
 */
final class Commands {

    static final int OK = 0;
    static final int USAGE = 1;
    static final int FAILED = 2;

    private final PrintStream out;
    private final PrintStream err;
    private final boolean showProgress;
    private final Clock clock;

    Commands(PrintStream out, PrintStream err, boolean showProgress, Clock clock) {
        this.out = out;
        this.err = err;
        this.showProgress = showProgress;
        this.clock = clock;
    }

    int split(Path input, GridSpec grid, Path outputParent) {
        out.println("=== Image Splitting Mode ===");
        out.println("Input: " + input);
        Timing timing = new Timing();
        try {
            SplitPipeline pipeline = new SplitPipeline(Status.console(out), progress(), clock);
            SplitResult r = outputParent == null
                    ? pipeline.split(input, grid)
                    : pipeline.split(input, grid, outputParent);
            endProgress();
            out.println("Image successfully split into " + r.cellFiles().size() + " cells!");
            out.println("Results saved to folder: " + r.outputDirectory());
            out.println(timing.format("Total processing"));
            return OK;
        } catch (GridImageException e) {
            endProgress();
            err.println(describe(e));
            return FAILED;
        }
    }

    int merge(Path inputDir, GridSpec grid, Path output) {
        out.println("=== Frame Merging Mode ===");
        Timing timing = new Timing();
        try {
            List<Path> files = ImageFiles.list(inputDir);
            MergePipeline pipeline = new MergePipeline(ImageLoader::load, Status.console(out), progress());
            MergeResult r = pipeline.merge(files, grid, output);
            endProgress();
            r.report().failures().forEach(f -> out.println(f.describe()));
            if (r.report().hasFailures()) {
                out.println(r.report().failures().size() + " cell(s) could not be read and were left blank");
            }
            out.println("Frames successfully merged!");
            out.println("Result saved: " + r.output() + " (" + r.width() + "x" + r.height()
                    + (r.alpha() ? ", with transparency)" : ")"));
            out.println(timing.format("Total processing"));
            return OK;
        } catch (GridImageException e) {
            endProgress();
            err.println(describe(e));
            return FAILED;
        }
    }

    /** One distinct headline per failure kind. */
    static String describe(GridImageException e) {
        String headline = switch (e.getErrorCode()) {
            case "INVALID_GRID" -> "Invalid grid";
            case "INVALID_CELL_SIZE" -> "Invalid image dimensions";
            case "SIZE_OVERFLOW" -> "Image too large";
            case "DECODE" -> "Cannot read image";
            case "RESOURCE_EXHAUSTED" -> "Insufficient memory";
            case "PATH" -> "File system";
            default -> "Failed";
        };
        return "Error: " + headline + ": " + e.getMessage();
    }

    private Consumer<String> progress() {
        return Status.progress(out, showProgress);
    }

    private void endProgress() {
        if (showProgress) {
            out.println();
        }
    }
}
