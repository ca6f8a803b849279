package github.sarthakdev143.reel_factory.service;

import github.sarthakdev143.reel_factory.model.RenderedSegment;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface SegmentStitcher {

    /**
     * Joins {@code segments} in the given order into {@code artifactPath}, replacing any previous file there.
     */
    Path stitch(List<RenderedSegment> segments, Path workDir, Path artifactPath) throws IOException, InterruptedException;
}
