package pipeline;

import error.InvalidGridException;
import error.PathException;
import grid.CellRect;
import grid.GridGeometry;
import grid.GridSpec;
import io.CellNaming;
import io.ImageFiles;
import io.ImageLoader;
import io.ImageWriter;
import io.OutputPaths;
import util.Tiles;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Source image to grid cells on disk. Cells are extracted and written one at a time;
 * if a write fails half way the cells already written are left in place.
 */
public class SplitPipeline {

    private final Consumer<String> status;
    private final Consumer<String> progress;
    private final Clock clock;

    public SplitPipeline(Consumer<String> status, Consumer<String> progress, Clock clock) {
        this.status = status;
        this.progress = progress;
        this.clock = clock;
    }

    /** Writes the cell folder next to the source image. */
    public SplitResult split(Path source, GridSpec grid) {
        Path parent = source.toAbsolutePath().getParent();
        return split(source, grid, parent);
    }

    public SplitResult split(Path source, GridSpec grid, Path outputParent) {
        if (!Files.isRegularFile(source)) {
            throw new PathException("File not found: " + source);
        }
        if (!ImageFiles.isSupported(source)) {
            throw new PathException("Unsupported file format: " + source.getFileName()
                    + ". Supported formats: PNG, JPG, JPEG, BMP");
        }

        BufferedImage src = ImageLoader.load(source);
        int W = src.getWidth(), H = src.getHeight();
        status.accept("Image loaded: " + W + "x" + H + " pixels");

        if (!grid.fits(W, H)) {
            throw new InvalidGridException("Grid " + grid + " is finer than the " + W + "x" + H
                    + " image: at most " + H + " rows and " + W + " columns are possible");
        }

        Path outDir = OutputPaths.splitDirectory(outputParent, source, LocalDateTime.now(clock));
        try {
            Files.createDirectories(outDir);
        } catch (IOException e) {
            throw new PathException("Could not create output folder " + outDir + ": " + e.getMessage(), e);
        }

        int baseW = GridGeometry.baseCellWidth(W, grid);
        int baseH = GridGeometry.baseCellHeight(H, grid);
        status.accept("Size of each cell: " + baseW + "x" + baseH + " pixels");

        List<CellRect> cells = GridGeometry.computeCells(W, H, grid);
        List<Path> written = new ArrayList<>(cells.size());
        int seq = 1;
        for (CellRect rect : cells) {
            BufferedImage cell = Tiles.extract(src, rect);
            Path file = outDir.resolve(CellNaming.fileName(seq, rect.row() + 1, rect.column() + 1));
            ImageWriter.writePng(cell, file);
            cell.flush();
            written.add(file);
            progress.accept("Processed cells: " + seq + "/" + cells.size());
            seq++;
        }
        src.flush();

        return new SplitResult(outDir, written, baseW, baseH);
    }
}
