package github.sarthakdev143.reel_factory.exception;

public class MediaResolutionException extends ReelPipelineException {

    public MediaResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
