package hw;

import error.ResourceExhaustedException;

public class MemoryGuard {
    // Fraction of the heap still obtainable that one canvas may take
    private final double fractionOfAvailable;

    public MemoryGuard(double fractionOfAvailable) {
        this.fractionOfAvailable = fractionOfAvailable;
    }

    /** Heap the JVM can still hand out: max heap minus what is in use now. */
    public static long availableBytes() {
        Runtime rt = Runtime.getRuntime();
        long available = rt.maxMemory() - (rt.totalMemory() - rt.freeMemory());
        return Math.max(0L, available);
    }

    /** ARGB and RGB canvases both store one int per pixel. */
    public static long estimateCanvasBytes(CanvasSize size) {
        return size.pixels() * 4L;
    }

    public long ceilingBytes() {
        return (long) (availableBytes() * fractionOfAvailable);
    }

    /** Fails before allocation when the canvas cannot plausibly fit the heap. */
    public void checkCanvas(CanvasSize size) {
        long needed = estimateCanvasBytes(size);
        long ceiling = ceilingBytes();
        if (needed > ceiling) {
            throw new ResourceExhaustedException(String.format(
                    "Insufficient memory to create final image: %dx%d needs %d MB, about %d MB available",
                    size.width(), size.height(), needed >> 20, ceiling >> 20));
        }
    }
}
