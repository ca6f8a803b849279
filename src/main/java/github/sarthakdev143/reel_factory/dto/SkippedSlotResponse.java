package github.sarthakdev143.reel_factory.dto;

public record SkippedSlotResponse(
        String slot,
        String reason) {
}
