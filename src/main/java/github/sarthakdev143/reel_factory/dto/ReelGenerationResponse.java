package github.sarthakdev143.reel_factory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ReelGenerationResponse(
        String status,
        @JsonProperty("video_url") String videoUrl,
        @JsonProperty("request_id") String requestId,
        @JsonProperty("rendered_slots") List<String> renderedSlots,
        @JsonProperty("skipped_slots") List<SkippedSlotResponse> skippedSlots) {
}
