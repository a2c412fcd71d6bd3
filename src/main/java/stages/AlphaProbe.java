package stages;

import error.GridImageException;
import io.ImageFiles;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Decides whether a merged canvas needs an alpha channel by looking at a bounded
 * sample of the inputs. Transparency outside the sampled files or outside the
 * top-left block goes unnoticed.
 */
public final class AlphaProbe {

    public static final int MAX_PROBED_FILES = 5;
    public static final int SAMPLE_SIZE = 10;

    private final CellDecoder decoder;
    private final Consumer<String> status;

    public AlphaProbe(CellDecoder decoder, Consumer<String> status) {
        this.decoder = decoder;
        this.status = status;
    }

    public static boolean formatImpliesAlpha(BufferedImage image) {
        return image.getColorModel().hasAlpha();
    }

    /** Containers able to carry per-pixel transparency. */
    public static boolean containerSupportsAlpha(Path file) {
        return ".png".equals(ImageFiles.extension(file));
    }

    public static boolean sampledRegionHasTransparency(BufferedImage image, int maxX, int maxY) {
        int w = Math.min(image.getWidth(), maxX);
        int h = Math.min(image.getHeight(), maxY);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if ((image.getRGB(x, y) >>> 24) < 0xFF) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean requiresAlpha(List<Path> imagePaths) {
        int probed = Math.min(imagePaths.size(), MAX_PROBED_FILES);
        for (int i = 0; i < probed; i++) {
            Path file = imagePaths.get(i);
            BufferedImage image;
            try {
                image = decoder.decode(file);
            } catch (GridImageException e) {
                status.accept("Alpha probe skipped " + file.getFileName() + ": " + e.getMessage());
                continue;
            }
            if (formatImpliesAlpha(image)
                    || (containerSupportsAlpha(file) && sampledRegionHasTransparency(image, SAMPLE_SIZE, SAMPLE_SIZE))) {
                status.accept("Transparency detected in images - will be preserved in result");
                return true;
            }
        }
        return false;
    }
}
