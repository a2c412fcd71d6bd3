package stages;

import error.ResourceExhaustedException;
import hw.CanvasSize;
import util.Tiles;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * The merge output buffer. A canvas owns its pixels outright: cells are copied in,
 * never referenced, and once {@link #freeze()} hands the image out no further
 * drawing is accepted.
 */
public final class Canvas {

    private static final Color TRANSPARENT = new Color(0, 0, 0, 0);

    private final BufferedImage pixels;
    private final boolean alpha;
    private final Color background;
    private boolean frozen;

    private Canvas(BufferedImage pixels, boolean alpha) {
        this.pixels = pixels;
        this.alpha = alpha;
        this.background = alpha ? TRANSPARENT : Color.WHITE;
    }

    public static Canvas allocate(CanvasSize size, boolean alpha) {
        BufferedImage img;
        try {
            img = new BufferedImage(size.width(), size.height(),
                    alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        } catch (OutOfMemoryError e) {
            throw new ResourceExhaustedException("Insufficient memory to create final image ("
                    + size.width() + "x" + size.height() + ")", e);
        }
        Canvas canvas = new Canvas(img, alpha);
        canvas.fillBackground(0, 0, size.width(), size.height());
        return canvas;
    }

    public boolean hasAlpha() {
        return alpha;
    }

    public void fillBackground(int x, int y, int w, int h) {
        checkOpen();
        Graphics2D g = pixels.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.setColor(background);
            g.fillRect(x, y, w, h);
        } finally {
            g.dispose();
        }
    }

    /**
     * Draws {@code cell} into the {@code w x h} box at {@code (x, y)}. A cell of exactly
     * that size is copied pixel for pixel; any other size is stretched to fit.
     */
    public void draw(BufferedImage cell, int x, int y, int w, int h) {
        checkOpen();
        boolean sameSize = cell.getWidth() == w && cell.getHeight() == h;
        if (sameSize && (alpha || !cell.getColorModel().hasAlpha())) {
            Tiles.copy(cell, pixels, x, y);
            return;
        }
        Graphics2D g = pixels.createGraphics();
        try {
            // an opaque canvas blends translucent cells over white; an alpha canvas keeps them
            g.setComposite(alpha ? AlphaComposite.Src : AlphaComposite.SrcOver);
            if (!sameSize) {
                g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            }
            g.drawImage(cell, x, y, w, h, null);
        } finally {
            g.dispose();
        }
    }

    public BufferedImage freeze() {
        frozen = true;
        return pixels;
    }

    private void checkOpen() {
        if (frozen) {
            throw new IllegalStateException("Canvas already frozen");
        }
    }
}
