package hw;

/** Validated canvas dimensions; {@code oversized} marks a size past the soft limit. */
public record CanvasSize(int width, int height, boolean oversized) {

    public long pixels() {
        return (long) width * height;
    }
}
