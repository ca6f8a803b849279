package github.sarthakdev143.reel_factory.service;

import github.sarthakdev143.reel_factory.model.PipelineResult;
import github.sarthakdev143.reel_factory.model.ReelRequest;

import java.io.IOException;

public interface ReelPipelineService {

    /**
     * Runs the whole pipeline for one request and returns once the final video is written.
     * Script, stitch and empty-result failures surface as
     * {@link github.sarthakdev143.reel_factory.exception.ReelPipelineException}s; failed segments are only
     * reported in the result.
     */
    PipelineResult generate(ReelRequest request) throws IOException, InterruptedException;
}
