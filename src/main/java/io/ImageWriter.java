package io;

import error.PathException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class ImageWriter {
    private ImageWriter() {
    }

    public static Path writePng(BufferedImage img, Path out) {
        try {
            if (!ImageIO.write(img, "png", out.toFile())) {
                throw new PathException("No PNG writer available for " + out);
            }
            return out;
        } catch (IOException e) {
            throw new PathException("Failed to write " + out + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes next to {@code out} first and moves the file into place, so a failed
     * write never leaves a truncated PNG at the final path.
     */
    public static Path writePngAtomically(BufferedImage img, Path out) {
        Path dir = out.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, ".merge_", ".png.tmp");
            writePng(img, tmp);
            Files.move(tmp, out, StandardCopyOption.REPLACE_EXISTING);
            return out;
        } catch (IOException e) {
            throw new PathException("Failed to write " + out + ": " + e.getMessage(), e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    System.err.println("[ImageWriter] could not remove " + tmp + ": " + e.getMessage());
                }
            }
        }
    }
}
