package github.sarthakdev143.reel_factory.integration.video;

import github.sarthakdev143.reel_factory.config.ReelFactoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the ffmpeg binary with a list of arguments and turns a non-zero exit or a timeout into an
 * {@link IOException} carrying ffmpeg's combined output.
 */
@Component
public class FfmpegCommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegCommandRunner.class);

    private final String binary;
    private final Duration timeout;

    @Autowired
    public FfmpegCommandRunner(ReelFactoryProperties properties) {
        this(properties.ffmpeg().binary(), properties.ffmpeg().timeout());
    }

    public FfmpegCommandRunner(String binary, Duration timeout) {
        this.binary = binary;
        this.timeout = timeout;
    }

    public String run(List<String> arguments, String stage) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add(binary);
        command.addAll(arguments);

        logger.info("Running FFmpeg command for stage {}: {}", stage, String.join(" ", command));
        // output goes to a file so a process that never closes its streams cannot outlive the timeout
        Path outputFile = Files.createTempFile("ffmpeg-", ".log");
        try {
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile())
                    .start();

            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                process.destroyForcibly();
                throw new IOException(
                        "FFmpeg timed out after " + timeout + " during stage " + stage + ". Output: "
                                + readOutput(outputFile));
            }

            String output = readOutput(outputFile);
            if (process.exitValue() != 0) {
                throw new IOException(
                        "FFmpeg failed during stage "
                                + stage
                                + " with exit code "
                                + process.exitValue()
                                + ". Output: "
                                + output);
            }
            return output;
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }

    private static String readOutput(Path outputFile) throws IOException {
        return new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
    }
}
