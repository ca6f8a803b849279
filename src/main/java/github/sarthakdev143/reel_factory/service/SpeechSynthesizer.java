package github.sarthakdev143.reel_factory.service;

import java.io.IOException;
import java.nio.file.Path;

public interface SpeechSynthesizer {

    /**
     * Writes narration audio for {@code text} to {@code outputPath}.
     *
     * @throws github.sarthakdev143.reel_factory.exception.SegmentRenderException when no audio was produced
     */
    void synthesize(String text, Path outputPath) throws IOException;
}
