package stages;

import java.util.List;

public record CompositionReport(List<CellPlacement> placed, List<CellFailure> failures,
                                int ignoredInputs, int emptyPositions) {

    public CompositionReport {
        placed = List.copyOf(placed);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
