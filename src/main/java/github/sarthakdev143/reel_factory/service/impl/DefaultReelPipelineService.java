package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.config.ReelFactoryProperties;
import github.sarthakdev143.reel_factory.exception.ScriptGenerationException;
import github.sarthakdev143.reel_factory.model.MediaSlot;
import github.sarthakdev143.reel_factory.model.NarrationSet;
import github.sarthakdev143.reel_factory.model.PipelineResult;
import github.sarthakdev143.reel_factory.model.PipelineState;
import github.sarthakdev143.reel_factory.model.ReelRequest;
import github.sarthakdev143.reel_factory.model.RenderedSegment;
import github.sarthakdev143.reel_factory.model.SkippedSlot;
import github.sarthakdev143.reel_factory.model.SlotKind;
import github.sarthakdev143.reel_factory.model.VisualSource;
import github.sarthakdev143.reel_factory.service.MediaResolver;
import github.sarthakdev143.reel_factory.service.ReelPipelineService;
import github.sarthakdev143.reel_factory.service.ScriptNormalizer;
import github.sarthakdev143.reel_factory.service.SegmentRenderer;
import github.sarthakdev143.reel_factory.service.SegmentStitcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Runs one request end to end: media and script in parallel, one render per resolved slot, then a single
 * stitch once every render has settled.
 *
 * <p>Only a failed script, an empty segment list or a failed stitch fails the request. Any other problem drops
 * the affected slot and is reported in {@link PipelineResult#skippedSlots()}.
 */
@Service
public class DefaultReelPipelineService implements ReelPipelineService {

    static final String OUTRO_LABEL = "Thanks for watching!";

    private static final Logger logger = LoggerFactory.getLogger(DefaultReelPipelineService.class);

    private final ScriptNormalizer scriptNormalizer;
    private final MediaResolver mediaResolver;
    private final SegmentRenderer segmentRenderer;
    private final SegmentStitcher segmentStitcher;
    private final TaskExecutor taskExecutor;
    private final Path workRoot;
    private final Path outputDir;
    private final Counter succeededCounter;
    private final Counter failedCounter;
    private final Counter renderedSegmentCounter;
    private final Counter skippedSegmentCounter;

    @Autowired
    public DefaultReelPipelineService(
            ScriptNormalizer scriptNormalizer,
            MediaResolver mediaResolver,
            SegmentRenderer segmentRenderer,
            SegmentStitcher segmentStitcher,
            @Qualifier("pipelineExecutor") TaskExecutor taskExecutor,
            ReelFactoryProperties properties,
            MeterRegistry meterRegistry) {
        this(
                scriptNormalizer,
                mediaResolver,
                segmentRenderer,
                segmentStitcher,
                taskExecutor,
                Path.of(properties.storage().workDir()),
                Path.of(properties.storage().outputDir()),
                meterRegistry);
    }

    DefaultReelPipelineService(
            ScriptNormalizer scriptNormalizer,
            MediaResolver mediaResolver,
            SegmentRenderer segmentRenderer,
            SegmentStitcher segmentStitcher,
            TaskExecutor taskExecutor,
            Path workRoot,
            Path outputDir,
            MeterRegistry meterRegistry) {
        this.scriptNormalizer = scriptNormalizer;
        this.mediaResolver = mediaResolver;
        this.segmentRenderer = segmentRenderer;
        this.segmentStitcher = segmentStitcher;
        this.taskExecutor = taskExecutor;
        this.workRoot = workRoot;
        this.outputDir = outputDir;
        this.succeededCounter = meterRegistry.counter("reel_factory.pipelines", "outcome", "succeeded");
        this.failedCounter = meterRegistry.counter("reel_factory.pipelines", "outcome", "failed");
        this.renderedSegmentCounter = meterRegistry.counter("reel_factory.segments", "outcome", "rendered");
        this.skippedSegmentCounter = meterRegistry.counter("reel_factory.segments", "outcome", "skipped");
    }

    @Override
    public PipelineResult generate(ReelRequest request) throws IOException, InterruptedException {
        String requestId = UUID.randomUUID().toString();
        List<MediaSlot> slots = MediaSlot.forSceneCount(request.scenes().size());
        List<PipelineTask<?>> inFlight = new ArrayList<>();

        logger.info(
                "Accepted reel request {} topic='{}' category={} type={} scenes={} uploads={}",
                requestId,
                request.topic(),
                request.category(),
                request.lengthMode().toApiValue(),
                request.scenes().size(),
                request.uploads().keySet());

        RequestWorkspace workspace = RequestWorkspace.open(workRoot, requestId);
        try {
            transition(requestId, PipelineState.RESOLVING_MEDIA);
            Map<MediaSlot, PipelineTask<VisualSource>> mediaTasks = new LinkedHashMap<>();
            for (MediaSlot slot : slots) {
                PipelineTask<VisualSource> task = PipelineTask.submit(
                        "media " + slot,
                        () -> mediaResolver.resolve(
                                slot,
                                labelFor(slot, request),
                                lookupEnabled(slot, request),
                                request.uploads().get(slot.formKey()),
                                request.lengthMode(),
                                workspace.directory()),
                        taskExecutor);
                mediaTasks.put(slot, task);
                inFlight.add(task);
            }

            transition(requestId, PipelineState.GENERATING_SCRIPT);
            PipelineTask<NarrationSet> scriptTask = PipelineTask.submit(
                    "script",
                    () -> scriptNormalizer.generate(
                            request.topic(),
                            request.category(),
                            request.lengthMode(),
                            request.scenes()),
                    taskExecutor);
            inFlight.add(scriptTask);
            NarrationSet narration = awaitScript(scriptTask);

            transition(requestId, PipelineState.RENDERING);
            List<SkippedSlot> skippedSlots = new ArrayList<>();
            Map<MediaSlot, PipelineTask<RenderedSegment>> renderTasks = new LinkedHashMap<>();
            for (MediaSlot slot : slots) {
                VisualSource visual;
                try {
                    visual = await(mediaTasks.get(slot));
                } catch (RuntimeException mediaError) {
                    skip(requestId, skippedSlots, slot, "media unavailable: " + mediaError.getMessage());
                    continue;
                }

                PipelineTask<RenderedSegment> task = PipelineTask.submit(
                        "render " + slot,
                        () -> segmentRenderer.render(
                                slot,
                                narration.narrationFor(slot),
                                visual,
                                workspace.segmentPath(slot),
                                request.lengthMode()),
                        taskExecutor);
                renderTasks.put(slot, task);
                inFlight.add(task);
            }

            List<RenderedSegment> segments = new ArrayList<>();
            for (Map.Entry<MediaSlot, PipelineTask<RenderedSegment>> entry : renderTasks.entrySet()) {
                try {
                    segments.add(await(entry.getValue()));
                    renderedSegmentCounter.increment();
                } catch (RuntimeException renderError) {
                    skip(requestId, skippedSlots, entry.getKey(), "render failed: " + renderError.getMessage());
                }
            }
            skippedSlots.sort(Comparator.comparing(SkippedSlot::slot));

            transition(requestId, PipelineState.STITCHING);
            Path artifactPath = outputDir.resolve("reel-" + requestId + ".mp4");
            segmentStitcher.stitch(segments, workspace.directory(), artifactPath);

            transition(requestId, PipelineState.DONE);
            succeededCounter.increment();
            logger.info(
                    "Completed reel request {} artifact={} rendered={} skipped={}",
                    requestId,
                    artifactPath,
                    segments.size(),
                    skippedSlots.size());

            return new PipelineResult(
                    requestId,
                    artifactPath,
                    segments.stream().map(RenderedSegment::slot).toList(),
                    skippedSlots);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markFailed(requestId, e);
            throw e;
        } catch (IOException | RuntimeException e) {
            markFailed(requestId, e);
            throw e;
        } finally {
            settle(inFlight);
            workspace.close();
        }
    }

    private NarrationSet awaitScript(PipelineTask<NarrationSet> scriptTask) throws InterruptedException {
        try {
            return await(scriptTask);
        } catch (ScriptGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ScriptGenerationException("Script generation failed: " + e.getMessage(), null, e);
        }
    }

    private String labelFor(MediaSlot slot, ReelRequest request) {
        return switch (slot.kind()) {
            case INTRO -> request.topic();
            case OUTRO -> OUTRO_LABEL;
            case SCENE -> request.scenes().get(slot.sceneIndex()).name();
        };
    }

    private boolean lookupEnabled(MediaSlot slot, ReelRequest request) {
        return slot.kind() == SlotKind.SCENE && request.category().supportsPosterLookup();
    }

    private void skip(String requestId, List<SkippedSlot> skippedSlots, MediaSlot slot, String reason) {
        skippedSlots.add(new SkippedSlot(slot, reason));
        skippedSegmentCounter.increment();
        logger.warn("Request {} skipped {}: {}", requestId, slot, reason);
    }

    private void transition(String requestId, PipelineState state) {
        logger.info("Request {} -> {}", requestId, state);
    }

    private void markFailed(String requestId, Exception cause) {
        failedCounter.increment();
        logger.error("Request {} -> {}", requestId, PipelineState.FAILED, cause);
    }

    private static <T> T await(Future<T> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        }
    }

    /**
     * Stops whatever is still running and waits for it to return, so nothing writes into the workspace once
     * it is removed. Tasks that already finished are unaffected.
     */
    private void settle(List<PipelineTask<?>> inFlight) {
        inFlight.forEach(PipelineTask::cancelAndAwait);
    }
}
