package github.sarthakdev143.reel_factory.exception;

public class SegmentRenderException extends ReelPipelineException {

    public SegmentRenderException(String message) {
        super(message);
    }

    public SegmentRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
