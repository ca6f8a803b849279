package github.sarthakdev143.reel_factory.model;

public record SkippedSlot(MediaSlot slot, String reason) {
}
