package github.sarthakdev143.reel_factory.integration.media;

import java.io.IOException;
import java.net.URI;
import java.util.List;

public interface MediaSearchClient {

    /**
     * Looks up images for a free-text query, best match first. An empty list means nothing matched.
     */
    List<URI> search(String query) throws IOException;
}
