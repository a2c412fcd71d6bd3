package stages;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Decodes one input file. Implementations report failures with the
 * {@code error} exceptions; {@link io.ImageLoader#load(Path)} is the default.
 */
@FunctionalInterface
public interface CellDecoder {
    BufferedImage decode(Path file);
}
