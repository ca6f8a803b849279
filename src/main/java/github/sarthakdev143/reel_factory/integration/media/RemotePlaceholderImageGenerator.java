package github.sarthakdev143.reel_factory.integration.media;

import github.sarthakdev143.reel_factory.config.ReelFactoryProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

/**
 * Fetches a dark placeholder with light text from a placehold.co style service.
 */
@Component
@Order(1)
public class RemotePlaceholderImageGenerator implements PlaceholderImageGenerator {

    private final RemoteFileDownloader downloader;
    private final ReelFactoryProperties.Placeholder settings;

    public RemotePlaceholderImageGenerator(RemoteFileDownloader downloader, ReelFactoryProperties properties) {
        this.downloader = downloader;
        this.settings = properties.placeholder();
    }

    @Override
    public void generate(String text, int width, int height, Path target) throws IOException {
        downloader.download(buildUri(text, width, height), target);
    }

    URI buildUri(String text, int width, int height) {
        return UriComponentsBuilder.fromUriString(settings.baseUrl())
                .pathSegment(width + "x" + height, settings.background(), settings.foreground(), "png")
                .queryParam("text", text)
                .encode()
                .build()
                .toUri();
    }

    @Override
    public String source() {
        return "remote_placeholder";
    }
}
