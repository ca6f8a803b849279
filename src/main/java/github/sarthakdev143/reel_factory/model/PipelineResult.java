package github.sarthakdev143.reel_factory.model;

import java.nio.file.Path;
import java.util.List;

public record PipelineResult(
        String requestId,
        Path artifactPath,
        List<MediaSlot> renderedSlots,
        List<SkippedSlot> skippedSlots) {

    public PipelineResult {
        renderedSlots = renderedSlots == null ? List.of() : List.copyOf(renderedSlots);
        skippedSlots = skippedSlots == null ? List.of() : List.copyOf(skippedSlots);
    }
}
