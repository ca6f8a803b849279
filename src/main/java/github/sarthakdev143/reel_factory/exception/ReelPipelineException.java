package github.sarthakdev143.reel_factory.exception;

/**
 * Base type for pipeline failures. Script, stitch and empty-result failures end the request; media and render
 * failures only drop one slot from the final video.
 */
public abstract class ReelPipelineException extends RuntimeException {

    protected ReelPipelineException(String message) {
        super(message);
    }

    protected ReelPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
