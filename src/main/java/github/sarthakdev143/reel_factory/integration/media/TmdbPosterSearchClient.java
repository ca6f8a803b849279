package github.sarthakdev143.reel_factory.integration.media;

import com.fasterxml.jackson.databind.JsonNode;
import github.sarthakdev143.reel_factory.config.ReelFactoryProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Movie poster lookup against the TMDB search API.
 */
@Component
public class TmdbPosterSearchClient implements MediaSearchClient {

    private final RestClient restClient;
    private final ReelFactoryProperties.MediaSearch settings;

    public TmdbPosterSearchClient(
            @Qualifier("mediaSearchRestClient") RestClient restClient,
            ReelFactoryProperties properties) {
        this.restClient = restClient;
        this.settings = properties.mediaSearch();
    }

    @Override
    public List<URI> search(String query) throws IOException {
        if (settings.apiKey() == null || settings.apiKey().isBlank()) {
            throw new IOException("TMDB API key is not configured.");
        }

        JsonNode response;
        try {
            response = restClient.get()
                    .uri(builder -> builder
                            .path("/search/movie")
                            .queryParam("api_key", settings.apiKey().trim())
                            .queryParam("query", query)
                            .queryParam("include_adult", false)
                            .build())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new IOException("TMDB search failed: " + e.getMessage(), e);
        }

        List<URI> posters = new ArrayList<>();
        if (response == null) {
            return posters;
        }
        for (JsonNode result : response.path("results")) {
            String posterPath = result.path("poster_path").asText("");
            if (!posterPath.isBlank()) {
                posters.add(URI.create(trimTrailingSlash(settings.imageBaseUrl()) + posterPath));
            }
        }
        return posters;
    }

    private String trimTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
