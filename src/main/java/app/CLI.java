package app;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;

import error.InvalidGridException;
import grid.GridSpec;
import io.OutputPaths;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Command line entry for image-grid.
 * Example:
 * # split into 4 rows and 6 columns, next to the source
 * java -jar image-grid.jar split --input sheet.png --rows 4 --columns 6
 *
 * # merge a folder of cells back into one PNG
 * java -jar image-grid.jar merge --input-dir sheet_split_20240101_120000 --rows 4 --columns 6
 * --output sheet_merged.png
 *
 * # no arguments: interactive prompts
 * java -jar image-grid.jar
 *
 * Progress counters can be turned off with --quiet or -Dprogress=false.
 */
public final class CLI {

    // -------------------- Args --------------------
    static final class MainArgs {
        @Parameter(names = "--quiet", description = "Suppress the per-cell progress counter")
        boolean quiet = false;

        @Parameter(names = { "-h", "--help" }, help = true, description = "Show help")
        boolean help = false;
    }

    @Parameters(commandDescription = "Split one image into a rows x columns grid of PNG cells")
    static final class SplitArgs {
        @Parameter(names = "--input", description = "Source image (.png/.jpg/.jpeg/.bmp)", required = true)
        String input;

        @Parameter(names = "--rows", description = "Number of rows (positive)", required = true)
        int rows;

        @Parameter(names = "--columns", description = "Number of columns (positive)", required = true)
        int columns;

        @Parameter(names = "--out-dir", description = "Parent folder of the cell folder (default: next to the input)")
        String outDir;
    }

    @Parameters(commandDescription = "Merge a folder of cell images into one PNG")
    static final class MergeArgs {
        @Parameter(names = "--input-dir", description = "Folder with cell images, merged in file name order",
                required = true)
        String inputDir;

        @Parameter(names = "--rows", description = "Number of rows (positive)", required = true)
        int rows;

        @Parameter(names = "--columns", description = "Number of columns (positive)", required = true)
        int columns;

        @Parameter(names = "--output", description = "Result file; .png is appended when missing", required = true)
        String output;
    }

    public static void main(String[] argv) {
        int code = run(argv, System.in, System.out, System.err);
        if (code != Commands.OK) {
            System.exit(code);
        }
    }

    static int run(String[] argv, InputStream in, PrintStream out, PrintStream err) {
        MainArgs main = new MainArgs();
        SplitArgs split = new SplitArgs();
        MergeArgs merge = new MergeArgs();
        JCommander jc = JCommander.newBuilder()
                .programName("image-grid")
                .addObject(main)
                .addCommand("split", split)
                .addCommand("merge", merge)
                .build();
        try {
            jc.parse(argv);
        } catch (ParameterException pe) {
            err.println(pe.getMessage());
            jc.usage();
            return Commands.USAGE;
        }
        if (main.help) {
            jc.usage();
            return Commands.OK;
        }

        // Read progress preference from CLI flag OR JVM property (-Dprogress=false)
        boolean showProgress = !main.quiet && Boolean.parseBoolean(System.getProperty("progress", "true"));
        Commands commands = new Commands(out, err, showProgress, Clock.systemDefaultZone());

        String command = jc.getParsedCommand();
        if (command == null) {
            return new InteractiveShell(commands, in, out).run();
        }
        GridSpec grid;
        try {
            grid = command.equals("split")
                    ? new GridSpec(split.rows, split.columns)
                    : new GridSpec(merge.rows, merge.columns);
        } catch (InvalidGridException e) {
            err.println(Commands.describe(e));
            return Commands.USAGE;
        }

        if (command.equals("split")) {
            Path input = Paths.get(OutputPaths.unquote(split.input));
            Path outDir = split.outDir == null ? null : Paths.get(OutputPaths.unquote(split.outDir));
            return commands.split(input, grid, outDir);
        }
        return commands.merge(Paths.get(OutputPaths.unquote(merge.inputDir)), grid,
                Paths.get(OutputPaths.unquote(merge.output)));
    }
}
