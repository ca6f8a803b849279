package github.sarthakdev143.reel_factory.model;

import java.nio.file.Path;

public record RenderedSegment(MediaSlot slot, Path path) {
}
