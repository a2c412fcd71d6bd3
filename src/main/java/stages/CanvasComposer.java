package stages;

import error.GridImageException;
import error.ResourceExhaustedException;
import util.Result;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Lays decoded cell images onto a canvas in row-major order. A cell that cannot be
 * decoded leaves its position at the background colour; the merge carries on and
 * the failure ends up in the {@link CompositionReport}.
 */
public final class CanvasComposer {

    private final CellDecoder decoder;
    private final Consumer<String> progress;

    public CanvasComposer(CellDecoder decoder, Consumer<String> progress) {
        this.decoder = decoder;
        this.progress = progress;
    }

    public CompositionReport compose(Canvas canvas, List<Path> cellImages, int rows, int columns,
                                     int cellWidth, int cellHeight, boolean alphaRequired) {
        if (canvas.hasAlpha() != alphaRequired) {
            throw new IllegalArgumentException("Canvas alpha=" + canvas.hasAlpha()
                    + " does not match alphaRequired=" + alphaRequired);
        }
        long positions = (long) rows * columns;
        int total = (int) Math.min(positions, cellImages.size());

        List<CellPlacement> placed = new ArrayList<>();
        List<CellFailure> failures = new ArrayList<>();
        int index = 0;
        for (int row = 0; row < rows && index < cellImages.size(); row++) {
            for (int col = 0; col < columns && index < cellImages.size(); col++) {
                int x = col * cellWidth;
                int y = row * cellHeight;
                Result<CellPlacement, CellFailure> r = place(canvas, index, row, col, cellImages.get(index),
                        x, y, cellWidth, cellHeight);
                if (r instanceof Result.Ok<CellPlacement, CellFailure> ok) {
                    placed.add(ok.value);
                } else if (r instanceof Result.Err<CellPlacement, CellFailure> err) {
                    canvas.fillBackground(x, y, cellWidth, cellHeight);
                    failures.add(err.error);
                }
                index++;
                progress.accept("Processed images: " + index + "/" + total);
            }
        }
        int ignored = cellImages.size() - index;
        int empty = (int) (positions - index);
        return new CompositionReport(placed, failures, ignored, empty);
    }

    private Result<CellPlacement, CellFailure> place(Canvas canvas, int index, int row, int col, Path file,
                                                     int x, int y, int w, int h) {
        BufferedImage cell;
        try {
            cell = decoder.decode(file);
        } catch (GridImageException e) {
            return Result.err(new CellFailure(index, row, col, file, e.getErrorCode(), e.getMessage()));
        }
        try {
            boolean stretched = cell.getWidth() != w || cell.getHeight() != h;
            canvas.draw(cell, x, y, w, h);
            return Result.ok(new CellPlacement(index, row, col, file, stretched));
        } catch (OutOfMemoryError e) {
            ResourceExhaustedException ex = new ResourceExhaustedException(
                    "Insufficient memory to process file " + file, e);
            return Result.err(new CellFailure(index, row, col, file, ex.getErrorCode(), ex.getMessage()));
        } finally {
            cell.flush();
        }
    }
}
