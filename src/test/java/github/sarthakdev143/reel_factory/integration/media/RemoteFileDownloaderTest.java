package github.sarthakdev143.reel_factory.integration.media;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteFileDownloaderTest {

    private static final URI POSTER = URI.create("https://images.test/t/p/original/heat.jpg");

    @TempDir
    Path tempDir;

    private MockRestServiceServer server;
    private RemoteFileDownloader downloader;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        downloader = new RemoteFileDownloader(builder.build());
    }

    @Test
    void writesResponseBodyToTarget() throws Exception {
        server.expect(requestTo(POSTER.toString()))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(new byte[]{7, 8, 9}, MediaType.IMAGE_JPEG));
        Path target = tempDir.resolve("media_0.jpg");

        Path result = downloader.download(POSTER, target);

        assertThat(result).isEqualTo(target);
        assertThat(Files.readAllBytes(target)).containsExactly(7, 8, 9);
        server.verify();
    }

    @Test
    void nonSuccessStatusFailsAndLeavesNoFile() {
        server.expect(requestTo(POSTER.toString())).andRespond(withStatus(HttpStatus.NOT_FOUND));
        Path target = tempDir.resolve("media_0.jpg");

        assertThatThrownBy(() -> downloader.download(POSTER, target))
                .isInstanceOf(IOException.class);

        assertThat(target).doesNotExist();
    }

    @Test
    void emptyBodyIsAFailure() {
        server.expect(requestTo(POSTER.toString())).andRespond(withSuccess(new byte[0], MediaType.IMAGE_JPEG));
        Path target = tempDir.resolve("media_0.jpg");

        assertThatThrownBy(() -> downloader.download(POSTER, target))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("empty body");

        assertThat(target).doesNotExist();
    }
}
