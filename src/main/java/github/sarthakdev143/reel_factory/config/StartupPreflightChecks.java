package github.sarthakdev143.reel_factory.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "reel-factory.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final int FFMPEG_CHECK_TIMEOUT_SECONDS = 10;

    private final ReelFactoryProperties properties;

    public StartupPreflightChecks(ReelFactoryProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkFfmpegConfiguration();
        checkDirectories();
        warnIfMissing("reel-factory.script.api-key (GROQ_API_KEY)", properties.script().apiKey(),
                "script generation will fail for every request");
        warnIfMissing("reel-factory.speech.api-key (OPENAI_API_KEY)", properties.speech().apiKey(),
                "narration cannot be synthesized, so every segment will be skipped");
        warnIfMissing("reel-factory.media-search.api-key (TMDB_API_KEY)", properties.mediaSearch().apiKey(),
                "movie scenes will use placeholder images");
    }

    private void checkFfmpegConfiguration() {
        String binary = properties.ffmpeg().binary();
        boolean explicitPath = binary.contains("/") || binary.contains("\\");
        if (explicitPath && !Files.isRegularFile(Path.of(binary))) {
            throw new IllegalStateException(
                    "FFmpeg binary not found at " + Path.of(binary).toAbsolutePath()
                            + ". Set " + FFMPEG_PATH_ENV + " to a valid ffmpeg executable path.");
        }

        try {
            Process process = new ProcessBuilder(binary, "-version")
                    .redirectErrorStream(true)
                    .start();
            process.getInputStream().transferTo(OutputStream.nullOutputStream());
            boolean finished = process.waitFor(FFMPEG_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        "FFmpeg is not available on PATH. Install FFmpeg or set " + FFMPEG_PATH_ENV + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    "FFmpeg is not available on PATH. Install FFmpeg or set " + FFMPEG_PATH_ENV + ".",
                    e);
        }
    }

    private void checkDirectories() {
        for (String directory : new String[]{properties.storage().outputDir(), properties.storage().workDir()}) {
            Path path = Path.of(directory);
            try {
                Files.createDirectories(path);
            } catch (IOException e) {
                throw new IllegalStateException("Unable to create directory " + path.toAbsolutePath() + ".", e);
            }
            if (!Files.isWritable(path)) {
                throw new IllegalStateException("Directory is not writable: " + path.toAbsolutePath() + ".");
            }
        }
    }

    private void warnIfMissing(String propertyName, String value, String consequence) {
        if (value == null || value.isBlank()) {
            logger.warn("{} is not set; {}.", propertyName, consequence);
        }
    }
}
