package pipeline;

import java.nio.file.Path;
import java.util.List;

public record SplitResult(Path outputDirectory, List<Path> cellFiles, int baseCellWidth, int baseCellHeight) {

    public SplitResult {
        cellFiles = List.copyOf(cellFiles);
    }
}
