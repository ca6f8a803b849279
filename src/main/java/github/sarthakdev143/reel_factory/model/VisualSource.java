package github.sarthakdev143.reel_factory.model;

import java.nio.file.Path;

public record VisualSource(Path path, VisualKind kind) {
}
