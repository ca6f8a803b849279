package github.sarthakdev143.reel_factory.controller;

import github.sarthakdev143.reel_factory.config.ReelFactoryProperties;
import github.sarthakdev143.reel_factory.config.TestProperties;
import github.sarthakdev143.reel_factory.exception.NoSegmentsException;
import github.sarthakdev143.reel_factory.exception.ScriptGenerationException;
import github.sarthakdev143.reel_factory.model.ContentCategory;
import github.sarthakdev143.reel_factory.model.LengthMode;
import github.sarthakdev143.reel_factory.model.MediaSlot;
import github.sarthakdev143.reel_factory.model.PipelineResult;
import github.sarthakdev143.reel_factory.model.ReelRequest;
import github.sarthakdev143.reel_factory.model.SkippedSlot;
import github.sarthakdev143.reel_factory.service.ReelPipelineService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReelController.class)
@Import(ReelControllerTest.SceneLimitConfig.class)
class ReelControllerTest {

    @TestConfiguration
    static class SceneLimitConfig {

        @Bean
        ReelFactoryProperties reelFactoryProperties() {
            return TestProperties.withMaxScenes(3);
        }
    }

    private static final String ONE_SCENE = "[{\"name\": \"Heat\", \"details\": \"1995, Pacino and De Niro\"}]";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ReelPipelineService reelPipelineService;

    @Test
    void generateReturnsVideoUrlAndSlotReport() throws Exception {
        when(reelPipelineService.generate(any(ReelRequest.class))).thenReturn(new PipelineResult(
                "req-1",
                Path.of("output", "reel-req-1.mp4"),
                List.of(MediaSlot.intro(), MediaSlot.scene(0)),
                List.of(new SkippedSlot(MediaSlot.outro(), "render failed: no audio"))));

        mockMvc.perform(multipart("/generate-multi-scene")
                        .file(new MockMultipartFile("media_0", "heat.jpg", "image/jpeg", new byte[]{1}))
                        .file(new MockMultipartFile("stray", "stray.jpg", "image/jpeg", new byte[]{1}))
                        .param("topic", "Top heist films")
                        .param("category", "movie")
                        .param("type", "long")
                        .param("scenes", ONE_SCENE)
                        .header("Host", "reels.test")
                        .header("X-Forwarded-Proto", "https"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.video_url").value("https://reels.test/videos/reel-req-1.mp4"))
                .andExpect(jsonPath("$.request_id").value("req-1"))
                .andExpect(jsonPath("$.rendered_slots[0]").value("intro"))
                .andExpect(jsonPath("$.rendered_slots[1]").value("scene[0]"))
                .andExpect(jsonPath("$.skipped_slots[0].slot").value("outro"))
                .andExpect(jsonPath("$.skipped_slots[0].reason").value("render failed: no audio"));

        ArgumentCaptor<ReelRequest> captor = ArgumentCaptor.forClass(ReelRequest.class);
        verify(reelPipelineService).generate(captor.capture());
        ReelRequest request = captor.getValue();
        assertThat(request.topic()).isEqualTo("Top heist films");
        assertThat(request.category()).isEqualTo(ContentCategory.MOVIE);
        assertThat(request.lengthMode()).isEqualTo(LengthMode.LONG);
        assertThat(request.scenes()).singleElement().satisfies(scene -> {
            assertThat(scene.name()).isEqualTo("Heat");
            assertThat(scene.details()).isEqualTo("1995, Pacino and De Niro");
        });
        assertThat(request.uploads()).containsOnlyKeys("media_0");
    }

    @Test
    void defaultsToShortGeneralAndPlainHttp() throws Exception {
        when(reelPipelineService.generate(any(ReelRequest.class))).thenReturn(new PipelineResult(
                "req-2",
                Path.of("output", "reel-req-2.mp4"),
                List.of(MediaSlot.intro()),
                List.of()));

        mockMvc.perform(multipart("/generate-multi-scene")
                        .param("topic", "Desk gadgets")
                        .param("scenes", ONE_SCENE)
                        .header("Host", "localhost:8080"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.video_url").value("http://localhost:8080/videos/reel-req-2.mp4"));

        ArgumentCaptor<ReelRequest> captor = ArgumentCaptor.forClass(ReelRequest.class);
        verify(reelPipelineService).generate(captor.capture());
        assertThat(captor.getValue().category()).isEqualTo(ContentCategory.GENERAL);
        assertThat(captor.getValue().lengthMode()).isEqualTo(LengthMode.SHORT);
        assertThat(captor.getValue().uploads()).isEmpty();
    }

    @Test
    void missingTopicReturnsBadRequest() throws Exception {
        mockMvc.perform(multipart("/generate-multi-scene").param("scenes", ONE_SCENE))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("topic is required."));

        verifyNoInteractions(reelPipelineService);
    }

    @Test
    void invalidScenesJsonReturnsBadRequest() throws Exception {
        mockMvc.perform(multipart("/generate-multi-scene")
                        .param("topic", "Films")
                        .param("scenes", "[{name: Heat"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("Invalid scenes JSON")));

        verifyNoInteractions(reelPipelineService);
    }

    @Test
    void emptySceneListReturnsBadRequest() throws Exception {
        mockMvc.perform(multipart("/generate-multi-scene")
                        .param("topic", "Films")
                        .param("scenes", "[]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("scenes must contain at least one entry."));
    }

    @Test
    void tooManyScenesReturnsBadRequest() throws Exception {
        String scenes = IntStream.range(0, 4)
                .mapToObj(index -> "{\"name\": \"Film " + index + "\"}")
                .collect(Collectors.joining(",", "[", "]"));

        mockMvc.perform(multipart("/generate-multi-scene")
                        .param("topic", "Films")
                        .param("scenes", scenes))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("scenes must contain at most 3 entries."));
    }

    @Test
    void unknownTypeReturnsBadRequest() throws Exception {
        mockMvc.perform(multipart("/generate-multi-scene")
                        .param("topic", "Films")
                        .param("type", "medium")
                        .param("scenes", ONE_SCENE))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("type must be one of short, long."));
    }

    @Test
    void scriptFailureReturnsRawResponse() throws Exception {
        when(reelPipelineService.generate(any(ReelRequest.class)))
                .thenThrow(new ScriptGenerationException("Script response is not valid JSON.", "not json at all"));

        mockMvc.perform(multipart("/generate-multi-scene")
                        .param("topic", "Films")
                        .param("scenes", ONE_SCENE))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("AI failed: Script response is not valid JSON."))
                .andExpect(jsonPath("$.raw_response").value("not json at all"));
    }

    @Test
    void noSegmentsReturnsStitchFailure() throws Exception {
        when(reelPipelineService.generate(any(ReelRequest.class)))
                .thenThrow(new NoSegmentsException("No segments rendered successfully; nothing to stitch."));

        mockMvc.perform(multipart("/generate-multi-scene")
                        .param("topic", "Films")
                        .param("scenes", ONE_SCENE))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value(containsString("Stitch failed")))
                .andExpect(jsonPath("$.raw_response").doesNotExist());
    }

    @Test
    void unexpectedFailureReturnsGenericError() throws Exception {
        when(reelPipelineService.generate(any(ReelRequest.class))).thenThrow(new IllegalStateException("disk full"));

        mockMvc.perform(multipart("/generate-multi-scene")
                        .param("topic", "Films")
                        .param("scenes", ONE_SCENE))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Failed to generate video. Check server logs."));
    }
}
