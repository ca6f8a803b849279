package github.sarthakdev143.reel_factory.integration.media;

import github.sarthakdev143.reel_factory.integration.video.FfmpegCommandRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Draws the placeholder locally with ffmpeg's {@code color} source and {@code drawtext}, so a slot still
 * gets a visual when the placeholder service cannot be reached.
 */
@Component
@Order(2)
public class FfmpegPlaceholderImageGenerator implements PlaceholderImageGenerator {

    private static final String BACKGROUND = "0x111111";

    private final FfmpegCommandRunner commandRunner;

    public FfmpegPlaceholderImageGenerator(FfmpegCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public void generate(String text, int width, int height, Path target) throws IOException {
        try {
            commandRunner.run(buildArguments(text, width, height, target), "placeholder image");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while drawing placeholder.");
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    List<String> buildArguments(String text, int width, int height, Path target) {
        String drawText = "drawtext=text='"
                + escapeDrawText(text)
                + "':fontcolor=white:fontsize="
                + Math.min(width, height) / 12
                + ":x=(w-text_w)/2:y=(h-text_h)/2";
        return List.of(
                "-y",
                "-f",
                "lavfi",
                "-i",
                "color=c=" + BACKGROUND + ":s=" + width + "x" + height,
                "-vf",
                drawText,
                "-frames:v",
                "1",
                target.toString());
    }

    private String escapeDrawText(String text) {
        return text
                .replace("\\", "\\\\")
                .replace(":", "\\:")
                .replace("'", "\\'")
                .replace("%", "\\%");
    }

    @Override
    public String source() {
        return "local_placeholder";
    }
}
