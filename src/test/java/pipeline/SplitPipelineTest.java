package pipeline;

import error.InvalidGridException;
import error.PathException;
import grid.GridSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import util.Status;
import util.TestImages;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SplitPipelineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private final List<String> lines = new ArrayList<>();

    private SplitPipeline pipeline() {
        return new SplitPipeline(lines::add, Status.SILENT, CLOCK);
    }

    @Test
    void writesNamedCellsIntoTimestampedFolder() throws Exception {
        BufferedImage src = TestImages.noise(62, 41, 11);
        Path source = TestImages.png(dir, "sheet.png", src);

        SplitResult r = pipeline().split(source, new GridSpec(2, 3));

        assertEquals(dir.resolve("sheet_split_20240305_101530").toAbsolutePath(), r.outputDirectory());
        assertEquals(20, r.baseCellWidth());
        assertEquals(20, r.baseCellHeight());
        try (Stream<Path> s = Files.list(r.outputDirectory())) {
            List<String> names = s.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
            assertEquals(List.of(
                    "cell_001_row01_col01.png", "cell_002_row01_col02.png", "cell_003_row01_col03.png",
                    "cell_004_row02_col01.png", "cell_005_row02_col02.png", "cell_006_row02_col03.png"), names);
        }

        BufferedImage last = ImageIO.read(r.cellFiles().get(5).toFile());
        assertEquals(22, last.getWidth());
        assertEquals(21, last.getHeight());
        for (int y = 0; y < 21; y++) {
            for (int x = 0; x < 22; x++) {
                assertEquals(TestImages.rgb(src, 40 + x, 20 + y), TestImages.rgb(last, x, y));
            }
        }
        assertTrue(lines.contains("Image loaded: 62x41 pixels"));
        assertTrue(lines.contains("Size of each cell: 20x20 pixels"));
    }

    @Test
    void explicitOutputParentIsUsed() throws Exception {
        Path source = TestImages.png(dir, "a.png", TestImages.noise(8, 8, 2));
        Path parent = Files.createDirectory(dir.resolve("out"));

        SplitResult r = pipeline().split(source, new GridSpec(1, 1), parent);

        assertEquals(parent.resolve("a_split_20240305_101530"), r.outputDirectory());
        assertEquals(1, r.cellFiles().size());
    }

    @Test
    void gridFinerThanImageIsRejectedBeforeWriting() throws Exception {
        Path source = TestImages.png(dir, "tiny.png", TestImages.noise(4, 3, 5));

        assertThrows(InvalidGridException.class, () -> pipeline().split(source, new GridSpec(4, 2)));
        assertThrows(InvalidGridException.class, () -> pipeline().split(source, new GridSpec(1, 5)));
        try (Stream<Path> s = Files.list(dir)) {
            assertEquals(1, s.count());
        }
    }

    @Test
    void failedWriteKeepsCellsAlreadyWritten() throws Exception {
        Path source = TestImages.png(dir, "sheet.png", TestImages.noise(30, 10, 8));
        Path outDir = dir.resolve("sheet_split_20240305_101530");
        // a non-empty folder squatting on the third cell's name makes that write fail
        Path blocker = Files.createDirectories(outDir.resolve("cell_003_row01_col03.png"));
        Files.write(blocker.resolve("keep"), new byte[] { 0 });

        assertThrows(PathException.class, () -> pipeline().split(source, new GridSpec(1, 3)));

        assertTrue(Files.isRegularFile(outDir.resolve("cell_001_row01_col01.png")));
        assertTrue(Files.isRegularFile(outDir.resolve("cell_002_row01_col02.png")));
        assertNotNull(ImageIO.read(outDir.resolve("cell_002_row01_col02.png").toFile()));
    }

    @Test
    void rejectsMissingAndUnsupportedSources() throws Exception {
        assertThrows(PathException.class, () -> pipeline().split(dir.resolve("nope.png"), new GridSpec(1, 1)));

        Path gif = Files.write(dir.resolve("anim.gif"), new byte[] { 0 });
        PathException e = assertThrows(PathException.class, () -> pipeline().split(gif, new GridSpec(1, 1)));
        assertTrue(e.getMessage().contains("Supported formats"));
    }
}
