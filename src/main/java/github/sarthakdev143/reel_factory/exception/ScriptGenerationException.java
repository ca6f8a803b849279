package github.sarthakdev143.reel_factory.exception;

public class ScriptGenerationException extends ReelPipelineException {

    private final String rawResponse;

    public ScriptGenerationException(String message, String rawResponse) {
        super(message);
        this.rawResponse = rawResponse;
    }

    public ScriptGenerationException(String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse;
    }

    /**
     * Text returned by the generation service, or {@code null} when the call itself failed.
     */
    public String getRawResponse() {
        return rawResponse;
    }
}
