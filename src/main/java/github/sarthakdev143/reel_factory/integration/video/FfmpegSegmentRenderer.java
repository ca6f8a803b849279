package github.sarthakdev143.reel_factory.integration.video;

import github.sarthakdev143.reel_factory.exception.SegmentRenderException;
import github.sarthakdev143.reel_factory.model.EncodingProfile;
import github.sarthakdev143.reel_factory.model.LengthMode;
import github.sarthakdev143.reel_factory.model.MediaSlot;
import github.sarthakdev143.reel_factory.model.RenderedSegment;
import github.sarthakdev143.reel_factory.model.VisualKind;
import github.sarthakdev143.reel_factory.model.VisualSource;
import github.sarthakdev143.reel_factory.service.SegmentRenderer;
import github.sarthakdev143.reel_factory.service.SpeechSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class FfmpegSegmentRenderer implements SegmentRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegSegmentRenderer.class);

    private final SpeechSynthesizer speechSynthesizer;
    private final FfmpegCommandRunner commandRunner;
    private final EncodingProfile profile;

    @Autowired
    public FfmpegSegmentRenderer(SpeechSynthesizer speechSynthesizer, FfmpegCommandRunner commandRunner) {
        this(speechSynthesizer, commandRunner, EncodingProfile.DEFAULT);
    }

    FfmpegSegmentRenderer(
            SpeechSynthesizer speechSynthesizer,
            FfmpegCommandRunner commandRunner,
            EncodingProfile profile) {
        this.speechSynthesizer = speechSynthesizer;
        this.commandRunner = commandRunner;
        this.profile = profile;
    }

    @Override
    public RenderedSegment render(
            MediaSlot slot,
            String narration,
            VisualSource visual,
            Path outputPath,
            LengthMode lengthMode) {
        Path audioPath = audioPathFor(outputPath);
        try {
            speechSynthesizer.synthesize(narration, audioPath);

            List<String> arguments = visual.kind() == VisualKind.VIDEO
                    ? buildVideoSegmentArguments(visual.path(), audioPath, lengthMode, outputPath)
                    : buildImageSegmentArguments(visual.path(), audioPath, lengthMode, outputPath);
            commandRunner.run(arguments, "render segment " + slot);

            logger.info("Rendered segment {} from {} {}", slot, visual.kind(), visual.path().getFileName());
            return new RenderedSegment(slot, outputPath);
        } catch (SegmentRenderException e) {
            deleteIfExists(outputPath);
            throw e;
        } catch (IOException e) {
            deleteIfExists(outputPath);
            throw new SegmentRenderException("Failed to render segment " + slot + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deleteIfExists(outputPath);
            throw new SegmentRenderException("Interrupted while rendering segment " + slot, e);
        } finally {
            deleteIfExists(audioPath);
        }
    }

    List<String> buildImageSegmentArguments(Path imagePath, Path audioPath, LengthMode lengthMode, Path outputPath) {
        List<String> arguments = new ArrayList<>();
        arguments.add("-y");
        arguments.add("-loop");
        arguments.add("1");
        arguments.add("-i");
        arguments.add(imagePath.toString());
        arguments.add("-i");
        arguments.add(audioPath.toString());
        appendMuxArguments(arguments, lengthMode, outputPath);
        return arguments;
    }

    List<String> buildVideoSegmentArguments(Path videoPath, Path audioPath, LengthMode lengthMode, Path outputPath) {
        List<String> arguments = new ArrayList<>();
        arguments.add("-y");
        arguments.add("-stream_loop");
        arguments.add("-1");
        arguments.add("-i");
        arguments.add(videoPath.toString());
        arguments.add("-i");
        arguments.add(audioPath.toString());
        appendMuxArguments(arguments, lengthMode, outputPath);
        return arguments;
    }

    String buildScalePadFilter(LengthMode lengthMode) {
        int width = lengthMode.width();
        int height = lengthMode.height();
        return "scale="
                + width
                + ":"
                + height
                + ":force_original_aspect_ratio=decrease,pad="
                + width
                + ":"
                + height
                + ":(ow-iw)/2:(oh-ih)/2:black,setsar=1,format="
                + profile.pixelFormat();
    }

    private void appendMuxArguments(List<String> arguments, LengthMode lengthMode, Path outputPath) {
        arguments.add("-map");
        arguments.add("0:v:0");
        arguments.add("-map");
        arguments.add("1:a:0");
        arguments.add("-vf");
        arguments.add(buildScalePadFilter(lengthMode));
        arguments.add("-r");
        arguments.add(String.valueOf(profile.frameRate()));
        arguments.add("-c:v");
        arguments.add(profile.videoCodec());
        arguments.add("-preset");
        arguments.add(profile.preset());
        arguments.add("-crf");
        arguments.add(String.valueOf(profile.crf()));
        arguments.add("-pix_fmt");
        arguments.add(profile.pixelFormat());
        arguments.add("-c:a");
        arguments.add(profile.audioCodec());
        arguments.add("-b:a");
        arguments.add(profile.audioBitrate());
        arguments.add("-ar");
        arguments.add(String.valueOf(profile.audioSampleRate()));
        arguments.add("-ac");
        arguments.add(String.valueOf(profile.audioChannels()));
        arguments.add("-shortest");
        arguments.add(outputPath.toString());
    }

    private Path audioPathFor(Path outputPath) {
        String fileName = outputPath.getFileName().toString();
        int extensionIndex = fileName.lastIndexOf('.');
        String stem = extensionIndex > 0 ? fileName.substring(0, extensionIndex) : fileName;
        return outputPath.resolveSibling(stem + "-narration.mp3");
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
