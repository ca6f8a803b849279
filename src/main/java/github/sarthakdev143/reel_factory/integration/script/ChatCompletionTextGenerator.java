package github.sarthakdev143.reel_factory.integration.script;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import github.sarthakdev143.reel_factory.config.ReelFactoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.util.List;

/**
 * Text generation over an OpenAI-compatible chat completions endpoint, asking for a JSON object reply.
 */
@Component
public class ChatCompletionTextGenerator implements TextGenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(ChatCompletionTextGenerator.class);

    private final RestClient restClient;
    private final ReelFactoryProperties.Script settings;

    public ChatCompletionTextGenerator(
            @Qualifier("scriptRestClient") RestClient restClient,
            ReelFactoryProperties properties) {
        this.restClient = restClient;
        this.settings = properties.script();
    }

    @Override
    public String complete(String prompt) throws IOException {
        if (settings.apiKey() == null || settings.apiKey().isBlank()) {
            throw new IOException("Text generation API key is not configured.");
        }

        ChatCompletionRequest request = new ChatCompletionRequest(
                settings.model(),
                List.of(new ChatMessage("user", prompt)),
                new ResponseFormat("json_object"));

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new IOException("Text generation request failed: " + e.getMessage(), e);
        }

        JsonNode content = response == null
                ? null
                : response.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new IOException("Text generation response contained no message content.");
        }

        logger.debug("Text generation returned {} characters using model {}", content.asText().length(), settings.model());
        return content.asText();
    }

    record ChatCompletionRequest(
            String model,
            List<ChatMessage> messages,
            @JsonProperty("response_format") ResponseFormat responseFormat) {
    }

    record ChatMessage(String role, String content) {
    }

    record ResponseFormat(String type) {
    }
}
