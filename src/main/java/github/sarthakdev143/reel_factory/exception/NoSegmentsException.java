package github.sarthakdev143.reel_factory.exception;

public class NoSegmentsException extends ReelPipelineException {

    public NoSegmentsException(String message) {
        super(message);
    }
}
