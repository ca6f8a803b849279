package github.sarthakdev143.reel_factory.integration.speech;

import com.fasterxml.jackson.annotation.JsonProperty;
import github.sarthakdev143.reel_factory.config.ReelFactoryProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;

@Component
public class OpenAiSpeechClient implements SpeechSynthesisClient {

    private static final String AUDIO_FORMAT = "mp3";
    private static final MediaType AUDIO_MPEG = MediaType.parseMediaType("audio/mpeg");

    private final RestClient restClient;
    private final ReelFactoryProperties.Speech settings;

    public OpenAiSpeechClient(
            @Qualifier("speechRestClient") RestClient restClient,
            ReelFactoryProperties properties) {
        this.restClient = restClient;
        this.settings = properties.speech();
    }

    @Override
    public byte[] synthesize(String text) throws IOException {
        if (settings.apiKey() == null || settings.apiKey().isBlank()) {
            throw new IOException("Speech API key is not configured.");
        }

        try {
            byte[] audio = restClient.post()
                    .uri("/audio/speech")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(AUDIO_MPEG, MediaType.APPLICATION_OCTET_STREAM)
                    .body(new SpeechRequest(settings.model(), text, settings.voice(), AUDIO_FORMAT))
                    .retrieve()
                    .body(byte[].class);
            return audio == null ? new byte[0] : audio;
        } catch (RestClientException e) {
            throw new IOException("Speech request failed: " + e.getMessage(), e);
        }
    }

    record SpeechRequest(
            String model,
            String input,
            String voice,
            @JsonProperty("response_format") String responseFormat) {
    }
}
