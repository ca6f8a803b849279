package github.sarthakdev143.reel_factory.model;

public enum PipelineState {
    RESOLVING_MEDIA,
    GENERATING_SCRIPT,
    RENDERING,
    STITCHING,
    DONE,
    FAILED
}
