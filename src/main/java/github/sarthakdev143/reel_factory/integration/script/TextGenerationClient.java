package github.sarthakdev143.reel_factory.integration.script;

import java.io.IOException;

public interface TextGenerationClient {

    /**
     * Sends one prompt and returns the raw text of the model's reply.
     *
     * @throws IOException when the service is unreachable, answers with a non-2xx status or returns no text
     */
    String complete(String prompt) throws IOException;
}
