package github.sarthakdev143.reel_factory.service;

import github.sarthakdev143.reel_factory.model.LengthMode;
import github.sarthakdev143.reel_factory.model.MediaSlot;
import github.sarthakdev143.reel_factory.model.RenderedSegment;
import github.sarthakdev143.reel_factory.model.VisualSource;

import java.nio.file.Path;

public interface SegmentRenderer {

    RenderedSegment render(
            MediaSlot slot,
            String narration,
            VisualSource visual,
            Path outputPath,
            LengthMode lengthMode);
}
