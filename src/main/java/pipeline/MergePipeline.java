package pipeline;

import error.DecodeException;
import error.PathException;
import grid.GridSpec;
import hw.CanvasSize;
import hw.MemoryGuard;
import hw.SizeGuard;
import io.ImageWriter;
import io.OutputPaths;
import stages.AlphaProbe;
import stages.Canvas;
import stages.CanvasComposer;
import stages.CellDecoder;
import stages.CompositionReport;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Ordered cell images to one PNG. The first image fixes the cell size for the whole
 * grid; every other cell is stretched to it.
 */
public class MergePipeline {

    // share of the remaining heap one canvas may claim
    private static final double CANVAS_HEAP_FRACTION = 0.9;

    private final CellDecoder decoder;
    private final Consumer<String> status;
    private final Consumer<String> progress;
    private final MemoryGuard memory;

    public MergePipeline(CellDecoder decoder, Consumer<String> status, Consumer<String> progress) {
        this(decoder, status, progress, new MemoryGuard(CANVAS_HEAP_FRACTION));
    }

    public MergePipeline(CellDecoder decoder, Consumer<String> status, Consumer<String> progress,
                         MemoryGuard memory) {
        this.decoder = decoder;
        this.status = status;
        this.progress = progress;
        this.memory = memory;
    }

    public MergeResult merge(List<Path> imageFiles, GridSpec grid, Path requestedOutput) {
        if (imageFiles.isEmpty()) {
            throw new PathException("No images found to merge");
        }
        status.accept("Found " + imageFiles.size() + " images");
        if (grid.cellCount() != imageFiles.size()) {
            status.accept("Warning: Number of cells (" + grid.cellCount()
                    + ") does not match number of images (" + imageFiles.size() + ")");
            status.accept("The first " + Math.min(grid.cellCount(), imageFiles.size()) + " images will be used");
        }

        Path output = OutputPaths.withPngExtension(requestedOutput);
        Path outDir = output.toAbsolutePath().getParent();
        if (outDir != null && !Files.isDirectory(outDir)) {
            throw new PathException("Folder does not exist: " + outDir);
        }

        BufferedImage first;
        try {
            first = decoder.decode(imageFiles.get(0));
        } catch (PathException | DecodeException e) {
            throw new DecodeException("First file " + imageFiles.get(0)
                    + " could not be read, cell size unknown: " + e.getMessage(), e);
        }
        int cellWidth = first.getWidth();
        int cellHeight = first.getHeight();
        first.flush();
        status.accept("Size of each cell: " + cellWidth + "x" + cellHeight + " pixels");

        CanvasSize size = new SizeGuard(status).validateCanvasSize(cellWidth, cellHeight, grid.rows(), grid.columns());
        status.accept("Final image size: " + size.width() + "x" + size.height() + " pixels");

        boolean alpha = new AlphaProbe(decoder, status).requiresAlpha(imageFiles);

        memory.checkCanvas(size);
        Canvas canvas = Canvas.allocate(size, alpha);
        CompositionReport report = new CanvasComposer(decoder, progress)
                .compose(canvas, imageFiles, grid.rows(), grid.columns(), cellWidth, cellHeight, alpha);
        BufferedImage composed = canvas.freeze();

        ImageWriter.writePngAtomically(composed, output);
        composed.flush();
        return new MergeResult(output, size.width(), size.height(), alpha, report);
    }
}
