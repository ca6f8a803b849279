package github.sarthakdev143.reel_factory.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.reel_factory.config.ReelFactoryProperties;
import github.sarthakdev143.reel_factory.config.StaticVideoConfig;
import github.sarthakdev143.reel_factory.dto.ReelErrorResponse;
import github.sarthakdev143.reel_factory.dto.ReelGenerationResponse;
import github.sarthakdev143.reel_factory.dto.SkippedSlotResponse;
import github.sarthakdev143.reel_factory.exception.ConcatenationException;
import github.sarthakdev143.reel_factory.exception.NoSegmentsException;
import github.sarthakdev143.reel_factory.exception.ScriptGenerationException;
import github.sarthakdev143.reel_factory.model.ContentCategory;
import github.sarthakdev143.reel_factory.model.LengthMode;
import github.sarthakdev143.reel_factory.model.MediaSlot;
import github.sarthakdev143.reel_factory.model.PipelineResult;
import github.sarthakdev143.reel_factory.model.ReelRequest;
import github.sarthakdev143.reel_factory.model.SceneDescriptor;
import github.sarthakdev143.reel_factory.service.ReelPipelineService;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
public class ReelController {

    private static final Logger logger = LoggerFactory.getLogger(ReelController.class);
    private static final int MAX_TOPIC_LENGTH = 200;

    private final ReelPipelineService reelPipelineService;
    private final ObjectMapper objectMapper;
    private final int maxScenes;

    public ReelController(
            ReelPipelineService reelPipelineService,
            ObjectMapper objectMapper,
            ReelFactoryProperties properties) {
        this.reelPipelineService = reelPipelineService;
        this.objectMapper = objectMapper;
        this.maxScenes = properties.pipeline().maxScenes();
    }

    @PostMapping(value = "/generate-multi-scene", consumes = "multipart/form-data")
    public ResponseEntity<?> generateMultiScene(
            @RequestParam(value = "topic", required = false) String topic,
            @RequestParam(value = "category", required = false) String categoryInput,
            @RequestParam(value = "type", required = false) String typeInput,
            @RequestParam(value = "scenes", required = false) String scenesInput,
            @RequestParam Map<String, MultipartFile> files,
            HttpServletRequest httpRequest) {

        ReelRequest reelRequest;
        try {
            reelRequest = buildRequest(topic, categoryInput, typeInput, scenesInput, files);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ReelErrorResponse.of(e.getMessage()));
        }

        try {
            PipelineResult result = reelPipelineService.generate(reelRequest);
            return ResponseEntity.ok(toResponse(result, httpRequest));
        } catch (ScriptGenerationException e) {
            logger.error("Script generation failed for topic '{}'", reelRequest.topic(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ReelErrorResponse("AI failed: " + e.getMessage(), e.getRawResponse()));
        } catch (NoSegmentsException | ConcatenationException e) {
            logger.error("Stitching failed for topic '{}'", reelRequest.topic(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ReelErrorResponse.of("Stitch failed: " + e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Reel generation interrupted for topic '{}'", reelRequest.topic(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ReelErrorResponse.of("Video generation was interrupted."));
        } catch (Exception e) {
            logger.error("Reel generation failed for topic '{}'", reelRequest.topic(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ReelErrorResponse.of("Failed to generate video. Check server logs."));
        }
    }

    private ReelRequest buildRequest(
            String topic,
            String categoryInput,
            String typeInput,
            String scenesInput,
            Map<String, MultipartFile> files) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic is required.");
        }
        if (topic.trim().length() > MAX_TOPIC_LENGTH) {
            throw new IllegalArgumentException("topic must be at most " + MAX_TOPIC_LENGTH + " characters.");
        }

        LengthMode lengthMode = LengthMode.fromInput(typeInput);
        ContentCategory category = ContentCategory.fromInput(categoryInput);
        List<SceneDescriptor> scenes = parseScenes(scenesInput);

        return new ReelRequest(topic, category, lengthMode, scenes, slotUploads(files, scenes.size()));
    }

    private List<SceneDescriptor> parseScenes(String scenesInput) {
        if (scenesInput == null || scenesInput.isBlank()) {
            throw new IllegalArgumentException("scenes is required.");
        }

        List<SceneDescriptor> scenes;
        try {
            scenes = objectMapper.readValue(scenesInput, new TypeReference<List<SceneDescriptor>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid scenes JSON: " + e.getOriginalMessage());
        }

        if (scenes == null || scenes.isEmpty()) {
            throw new IllegalArgumentException("scenes must contain at least one entry.");
        }
        if (scenes.size() > maxScenes) {
            throw new IllegalArgumentException("scenes must contain at most " + maxScenes + " entries.");
        }
        for (int index = 0; index < scenes.size(); index++) {
            if (scenes.get(index) == null) {
                throw new IllegalArgumentException("scenes[" + index + "] must be an object.");
            }
        }
        return scenes;
    }

    /**
     * Keeps only files posted under a slot's form key; anything else in the form is ignored.
     */
    private Map<String, MultipartFile> slotUploads(Map<String, MultipartFile> files, int sceneCount) {
        Map<String, MultipartFile> uploads = new HashMap<>();
        if (files == null) {
            return uploads;
        }
        for (MediaSlot slot : MediaSlot.forSceneCount(sceneCount)) {
            MultipartFile file = files.get(slot.formKey());
            if (file != null && !file.isEmpty()) {
                uploads.put(slot.formKey(), file);
            }
        }
        return uploads;
    }

    private ReelGenerationResponse toResponse(PipelineResult result, HttpServletRequest httpRequest) {
        List<String> renderedSlots = result.renderedSlots().stream()
                .map(MediaSlot::toString)
                .toList();
        List<SkippedSlotResponse> skippedSlots = result.skippedSlots().stream()
                .map(skipped -> new SkippedSlotResponse(skipped.slot().toString(), skipped.reason()))
                .toList();

        return new ReelGenerationResponse(
                "success",
                buildVideoUrl(result, httpRequest),
                result.requestId(),
                renderedSlots,
                skippedSlots);
    }

    private String buildVideoUrl(PipelineResult result, HttpServletRequest httpRequest) {
        String scheme = httpRequest.getHeader("X-Forwarded-Proto");
        if (scheme == null || scheme.isBlank()) {
            scheme = httpRequest.isSecure() ? "https" : "http";
        } else {
            scheme = scheme.split(",")[0].trim();
        }

        String host = httpRequest.getHeader("Host");
        if (host == null || host.isBlank()) {
            host = httpRequest.getServerName() + ":" + httpRequest.getServerPort();
        }

        return scheme + "://" + host + StaticVideoConfig.PUBLIC_PATH + "/" + result.artifactPath().getFileName();
    }
}
