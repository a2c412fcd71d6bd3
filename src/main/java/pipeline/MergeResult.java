package pipeline;

import stages.CompositionReport;

import java.nio.file.Path;

public record MergeResult(Path output, int width, int height, boolean alpha, CompositionReport report) {
}
