package util;

/** Wall-clock stopwatch for the summary lines of the CLI. */
public class Timing {
    private final long t0 = System.nanoTime();

    public double elapsedMs() {
        return (System.nanoTime() - t0) / 1_000_000.0;
    }

    public String format(String label) {
        return String.format("%s: %.2f ms", label, elapsedMs());
    }
}
