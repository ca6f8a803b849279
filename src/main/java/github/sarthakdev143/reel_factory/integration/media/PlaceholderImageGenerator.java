package github.sarthakdev143.reel_factory.integration.media;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Produces a plain image of the given size with {@code text} drawn on it. Implementations are tried in
 * {@link org.springframework.core.annotation.Order} until one succeeds.
 */
public interface PlaceholderImageGenerator {

    void generate(String text, int width, int height, Path target) throws IOException;

    String source();
}
