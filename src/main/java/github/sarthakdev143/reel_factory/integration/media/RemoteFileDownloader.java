package github.sarthakdev143.reel_factory.integration.media;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Component
public class RemoteFileDownloader {

    private final RestClient restClient;

    public RemoteFileDownloader(@Qualifier("downloadRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Streams the body of a GET to {@code target}. Non-2xx replies and empty bodies are failures, and the
     * partially written file is removed.
     */
    public Path download(URI uri, Path target) throws IOException {
        try {
            restClient.get()
                    .uri(uri)
                    .exchange((request, response) -> {
                        if (!response.getStatusCode().is2xxSuccessful()) {
                            throw new IOException("Download of " + uri + " returned status " + response.getStatusCode());
                        }
                        try (InputStream body = response.getBody()) {
                            Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
                        }
                        return target;
                    });
        } catch (RestClientException e) {
            Files.deleteIfExists(target);
            throw new IOException("Download of " + uri + " failed: " + e.getMessage(), e);
        }

        if (Files.size(target) == 0) {
            Files.deleteIfExists(target);
            throw new IOException("Download of " + uri + " returned an empty body.");
        }
        return target;
    }
}
