package stages;

import java.nio.file.Path;

/** A cell drawn onto the canvas; {@code stretched} when its native size differed. */
public record CellPlacement(int index, int row, int column, Path source, boolean stretched) {
}
