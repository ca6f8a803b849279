package github.sarthakdev143.reel_factory.exception;

public class ConcatenationException extends ReelPipelineException {

    public ConcatenationException(String message, Throwable cause) {
        super(message, cause);
    }
}
