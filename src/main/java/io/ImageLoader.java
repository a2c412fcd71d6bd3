package io;

import error.DecodeException;
import error.PathException;
import error.ResourceExhaustedException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public final class ImageLoader {
    private ImageLoader() {
    }

    /**
     * Decodes a PNG/JPEG/BMP file fully into memory. The stream is closed before this
     * returns, whatever the outcome.
     */
    public static BufferedImage load(Path input) {
        if (!Files.isRegularFile(input)) {
            throw new PathException("File not found: " + input);
        }
        BufferedImage img;
        try (InputStream in = Files.newInputStream(input)) {
            img = ImageIO.read(in);
        } catch (NoSuchFileException e) {
            throw new PathException("File not found: " + input, e);
        } catch (AccessDeniedException e) {
            throw new PathException("No access to file: " + input, e);
        } catch (IOException e) {
            throw new DecodeException("Failed to read image " + input + ": " + e.getMessage(), e);
        } catch (OutOfMemoryError e) {
            throw new ResourceExhaustedException("Insufficient memory to decode " + input, e);
        } catch (RuntimeException e) {
            // some ImageIO readers fail on truncated data with unchecked exceptions
            throw new DecodeException("Corrupt image data in " + input + ": " + e, e);
        }
        if (img == null) {
            throw new DecodeException("Unsupported or corrupt image data: " + input);
        }
        return img;
    }
}
