package github.sarthakdev143.reel_factory.integration.speech;

import java.io.IOException;

public interface SpeechSynthesisClient {

    /**
     * Synthesizes one chunk of narration and returns the encoded audio bytes (mp3).
     */
    byte[] synthesize(String text) throws IOException;
}
