package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.exception.MediaResolutionException;
import github.sarthakdev143.reel_factory.integration.media.MediaSearchClient;
import github.sarthakdev143.reel_factory.integration.media.PlaceholderImageGenerator;
import github.sarthakdev143.reel_factory.integration.media.RemoteFileDownloader;
import github.sarthakdev143.reel_factory.model.LengthMode;
import github.sarthakdev143.reel_factory.model.MediaSlot;
import github.sarthakdev143.reel_factory.model.VisualKind;
import github.sarthakdev143.reel_factory.model.VisualSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultMediaResolverTest {

    @Mock
    private MediaSearchClient mediaSearchClient;

    @Mock
    private RemoteFileDownloader downloader;

    @Mock
    private PlaceholderImageGenerator remotePlaceholder;

    @Mock
    private PlaceholderImageGenerator localPlaceholder;

    @TempDir
    Path workDir;

    private SimpleMeterRegistry meterRegistry;
    private DefaultMediaResolver resolver;

    @BeforeEach
    void setUp() {
        lenient().when(remotePlaceholder.source()).thenReturn("remote_placeholder");
        lenient().when(localPlaceholder.source()).thenReturn("local_placeholder");
        meterRegistry = new SimpleMeterRegistry();
        resolver = new DefaultMediaResolver(
                mediaSearchClient,
                downloader,
                List.of(remotePlaceholder, localPlaceholder),
                meterRegistry);
    }

    @Test
    void persistsImageUploadVerbatim() throws Exception {
        MockMultipartFile upload = new MockMultipartFile("media_0", "poster.PNG", "image/png", new byte[]{1, 2, 3});

        VisualSource visual = resolver.resolve(
                MediaSlot.scene(0), "Heat", true, upload, LengthMode.SHORT, workDir);

        assertThat(visual.kind()).isEqualTo(VisualKind.IMAGE);
        assertThat(visual.path()).isEqualTo(workDir.resolve("media_0.png"));
        assertThat(Files.readAllBytes(visual.path())).containsExactly(1, 2, 3);
        verifyNoInteractions(mediaSearchClient, downloader, remotePlaceholder, localPlaceholder);
    }

    @Test
    void detectsVideoUploadByExtensionOrContentType() {
        MockMultipartFile byExtension = new MockMultipartFile("media_intro", "clip.MOV", null, new byte[]{1});
        MockMultipartFile byContentType = new MockMultipartFile("media_outro", "clip", "video/mp4", new byte[]{1});

        VisualSource intro = resolver.resolve(
                MediaSlot.intro(), "Topic", false, byExtension, LengthMode.SHORT, workDir);
        VisualSource outro = resolver.resolve(
                MediaSlot.outro(), "Thanks for watching!", false, byContentType, LengthMode.SHORT, workDir);

        assertThat(intro.kind()).isEqualTo(VisualKind.VIDEO);
        assertThat(intro.path().getFileName().toString()).isEqualTo("media_intro.mov");
        assertThat(outro.kind()).isEqualTo(VisualKind.VIDEO);
        assertThat(outro.path().getFileName().toString()).isEqualTo("media_outro.jpg");
    }

    @Test
    void downloadsFirstSearchResultWhenLookupEnabled() throws Exception {
        URI poster = URI.create("https://images.test/heat.jpg");
        when(mediaSearchClient.search("Heat")).thenReturn(List.of(poster, URI.create("https://images.test/other.jpg")));

        VisualSource visual = resolver.resolve(MediaSlot.scene(2), "Heat", true, null, LengthMode.SHORT, workDir);

        assertThat(visual.kind()).isEqualTo(VisualKind.IMAGE);
        assertThat(visual.path()).isEqualTo(workDir.resolve("media_2.jpg"));
        verify(downloader).download(poster, workDir.resolve("media_2.jpg"));
        verifyNoInteractions(remotePlaceholder, localPlaceholder);
        assertThat(meterRegistry.counter("reel_factory.media.fallbacks", "source", "lookup").count()).isEqualTo(1.0);
    }

    @Test
    void fallsBackToPlaceholderWhenLookupFails() throws Exception {
        when(mediaSearchClient.search("Heat")).thenThrow(new IOException("TMDB API key is not configured."));

        VisualSource visual = resolver.resolve(MediaSlot.scene(0), "Heat", true, null, LengthMode.LONG, workDir);

        assertThat(visual.kind()).isEqualTo(VisualKind.IMAGE);
        verify(remotePlaceholder).generate("Heat", 1920, 1080, workDir.resolve("media_0-placeholder.png"));
        verifyNoInteractions(localPlaceholder);
    }

    @Test
    void fallsBackToPlaceholderWhenSearchFindsNothing() throws Exception {
        when(mediaSearchClient.search("Obscure")).thenReturn(List.of());

        resolver.resolve(MediaSlot.scene(0), "Obscure", true, null, LengthMode.SHORT, workDir);

        verify(remotePlaceholder).generate(eq("Obscure"), eq(1080), eq(1920), any(Path.class));
        verifyNoInteractions(downloader);
    }

    @Test
    void skipsLookupWhenDisabledAndUsesSceneLabelForBlankText() throws Exception {
        resolver.resolve(MediaSlot.scene(1), "  ", false, null, LengthMode.SHORT, workDir);

        verify(remotePlaceholder).generate(eq("Scene"), anyInt(), anyInt(), any(Path.class));
        verifyNoInteractions(mediaSearchClient, downloader);
    }

    @Test
    void usesLocalPlaceholderWhenRemoteServiceIsUnreachable() throws Exception {
        doThrow(new IOException("connection refused"))
                .when(remotePlaceholder).generate(anyString(), anyInt(), anyInt(), any(Path.class));

        VisualSource visual = resolver.resolve(MediaSlot.outro(), "Thanks for watching!", false, null, LengthMode.SHORT, workDir);

        assertThat(visual.kind()).isEqualTo(VisualKind.IMAGE);
        verify(localPlaceholder).generate("Thanks for watching!", 1080, 1920, workDir.resolve("media_outro-placeholder.png"));
        assertThat(meterRegistry.counter("reel_factory.media.fallbacks", "source", "local_placeholder").count())
                .isEqualTo(1.0);
    }

    @Test
    void failsWhenEveryPlaceholderRouteFails() throws Exception {
        doThrow(new IOException("remote down"))
                .when(remotePlaceholder).generate(anyString(), anyInt(), anyInt(), any(Path.class));
        doThrow(new IOException("ffmpeg missing"))
                .when(localPlaceholder).generate(anyString(), anyInt(), anyInt(), any(Path.class));

        assertThatThrownBy(() -> resolver.resolve(MediaSlot.intro(), "Topic", false, null, LengthMode.SHORT, workDir))
                .isInstanceOf(MediaResolutionException.class)
                .hasMessageContaining("intro")
                .hasRootCauseMessage("ffmpeg missing");
    }

    @Test
    void extensionFallsBackToJpgForMissingOrUnsafeNames() {
        assertThat(DefaultMediaResolver.extensionOf(null)).isEqualTo(".jpg");
        assertThat(DefaultMediaResolver.extensionOf("noext")).isEqualTo(".jpg");
        assertThat(DefaultMediaResolver.extensionOf("bad.j/pg")).isEqualTo(".jpg");
        assertThat(DefaultMediaResolver.extensionOf("clip.WEBM")).isEqualTo(".webm");
    }
}
