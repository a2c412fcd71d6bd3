package pipeline;

import error.DecodeException;
import error.PathException;
import error.ResourceExhaustedException;
import grid.GridSpec;
import hw.MemoryGuard;
import io.ImageFiles;
import io.ImageLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import util.Status;
import util.TestImages;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MergePipelineTest {

    @TempDir
    Path dir;

    private final List<String> lines = new ArrayList<>();

    private MergePipeline merger() {
        return new MergePipeline(ImageLoader::load, lines::add, Status.SILENT);
    }

    private SplitResult split(BufferedImage src, GridSpec grid) throws Exception {
        Path source = TestImages.png(dir, "src.png", src);
        return new SplitPipeline(Status.SILENT, Status.SILENT, Clock.systemUTC()).split(source, grid);
    }

    @Test
    void splitThenMergeReproducesEvenlyDivisibleImage() throws Exception {
        BufferedImage src = TestImages.noise(60, 40, 42);
        GridSpec grid = new GridSpec(2, 3);
        SplitResult parts = split(src, grid);

        MergeResult r = merger().merge(ImageFiles.list(parts.outputDirectory()), grid, dir.resolve("joined.png"));

        assertFalse(r.alpha());
        assertFalse(r.report().hasFailures());
        BufferedImage out = ImageIO.read(r.output().toFile());
        assertEquals(60, out.getWidth());
        assertEquals(40, out.getHeight());
        for (int y = 0; y < 40; y++) {
            for (int x = 0; x < 60; x++) {
                assertEquals(TestImages.rgb(src, x, y), TestImages.rgb(out, x, y), "pixel " + x + "," + y);
            }
        }
    }

    /**
     * With a remainder the canvas is baseW*C x baseH*R. Cells that were not in the last
     * row or column come back pixel-exact; the larger edge cells are rescaled.
     */
    @Test
    void splitThenMergeWithRemainderKeepsInnerCellsExact() throws Exception {
        BufferedImage src = TestImages.noise(62, 41, 9);
        GridSpec grid = new GridSpec(2, 3);
        SplitResult parts = split(src, grid);

        MergeResult r = merger().merge(ImageFiles.list(parts.outputDirectory()), grid, dir.resolve("joined.png"));

        assertEquals(60, r.width());
        assertEquals(40, r.height());
        BufferedImage out = ImageIO.read(r.output().toFile());
        for (int y = 0; y < 20; y++) {
            for (int x = 0; x < 40; x++) {
                assertEquals(TestImages.rgb(src, x, y), TestImages.rgb(out, x, y), "pixel " + x + "," + y);
            }
        }
        assertTrue(r.report().placed().get(5).stretched());
        assertFalse(r.report().placed().get(0).stretched());
    }

    @Test
    void transparentCellsProduceAlphaCanvas() throws Exception {
        List<Path> files = List.of(
                TestImages.png(dir, "a.png", TestImages.argbWithAlphaAt(6, 6, 0, 0, 0)),
                TestImages.png(dir, "b.png", TestImages.solid(6, 6, 0x112233)));

        MergeResult r = merger().merge(files, new GridSpec(2, 2), dir.resolve("out"));

        assertTrue(r.alpha());
        assertEquals(dir.resolve("out.png"), r.output());
        BufferedImage out = ImageIO.read(r.output().toFile());
        assertEquals(0, out.getRGB(0, 0) >>> 24);
        assertEquals(0xFFFF0000, out.getRGB(1, 1));
        assertEquals(0xFF112233, out.getRGB(7, 2));
        assertEquals(0, out.getRGB(3, 9) >>> 24);
        assertEquals(2, r.report().emptyPositions());
        assertTrue(lines.contains("Warning: Number of cells (4) does not match number of images (2)"));
    }

    @Test
    void corruptSecondFileBecomesBackground() throws Exception {
        List<Path> files = List.of(
                TestImages.png(dir, "1.png", TestImages.solid(5, 5, 0xFF0000)),
                TestImages.garbage(dir, "2.png"),
                TestImages.png(dir, "3.png", TestImages.solid(5, 5, 0x00FF00)),
                TestImages.png(dir, "4.png", TestImages.solid(5, 5, 0x0000FF)));

        MergeResult r = merger().merge(files, new GridSpec(2, 2), dir.resolve("m.png"));

        BufferedImage out = ImageIO.read(r.output().toFile());
        assertEquals(0xFF0000, TestImages.rgb(out, 2, 2));
        assertEquals(0xFFFFFF, TestImages.rgb(out, 7, 2));
        assertEquals(0x00FF00, TestImages.rgb(out, 2, 7));
        assertEquals(0x0000FF, TestImages.rgb(out, 7, 7));
        assertEquals(1, r.report().failures().size());
        assertTrue(r.report().failures().get(0).describe().startsWith("Error processing file"));
        assertTrue(lines.stream().noneMatch(l -> l.startsWith("Error processing file")));
    }

    @Test
    void unreadableFirstFileAbortsWithoutOutput() throws Exception {
        List<Path> files = List.of(
                TestImages.garbage(dir, "1.png"),
                TestImages.png(dir, "2.png", TestImages.solid(5, 5, 0)));
        Path out = dir.resolve("never.png");

        assertThrows(DecodeException.class, () -> merger().merge(files, new GridSpec(1, 2), out));
        assertFalse(Files.exists(out));
        try (var s = Files.list(dir)) {
            assertTrue(s.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void emptyInputAndMissingOutputFolderAreRejected() throws Exception {
        assertThrows(PathException.class, () -> merger().merge(List.of(), new GridSpec(1, 1), dir.resolve("x.png")));

        List<Path> files = List.of(TestImages.png(dir, "a.png", TestImages.solid(2, 2, 0)));
        assertThrows(PathException.class,
                () -> merger().merge(files, new GridSpec(1, 1), dir.resolve("no/such/dir/x.png")));
    }

    @Test
    void canvasPastMemoryCeilingAbortsWithoutOutput() throws Exception {
        List<Path> files = List.of(
                TestImages.png(dir, "1.png", TestImages.solid(5, 5, 0xFF0000)),
                TestImages.png(dir, "2.png", TestImages.solid(5, 5, 0x00FF00)));
        Path out = dir.resolve("big.png");
        MergePipeline noHeap = new MergePipeline(ImageLoader::load, lines::add, Status.SILENT, new MemoryGuard(0.0));

        ResourceExhaustedException e = assertThrows(ResourceExhaustedException.class,
                () -> noHeap.merge(files, new GridSpec(1, 2), out));

        assertEquals("RESOURCE_EXHAUSTED", e.getErrorCode());
        assertFalse(Files.exists(out));
        try (var s = Files.list(dir)) {
            assertTrue(s.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }
}
