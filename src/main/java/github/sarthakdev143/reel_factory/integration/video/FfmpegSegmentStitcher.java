package github.sarthakdev143.reel_factory.integration.video;

import github.sarthakdev143.reel_factory.exception.ConcatenationException;
import github.sarthakdev143.reel_factory.exception.NoSegmentsException;
import github.sarthakdev143.reel_factory.model.RenderedSegment;
import github.sarthakdev143.reel_factory.service.SegmentStitcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

@Component
public class FfmpegSegmentStitcher implements SegmentStitcher {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegSegmentStitcher.class);
    private static final String MANIFEST_FILE_NAME = "concat.txt";
    private static final String STAGED_FILE_NAME = "stitched.mp4";

    private final FfmpegCommandRunner commandRunner;

    public FfmpegSegmentStitcher(FfmpegCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public Path stitch(List<RenderedSegment> segments, Path workDir, Path artifactPath)
            throws IOException, InterruptedException {
        if (segments == null || segments.isEmpty()) {
            throw new NoSegmentsException("No segments rendered successfully; nothing to stitch.");
        }

        Path manifestPath = workDir.resolve(MANIFEST_FILE_NAME);
        Path stagedPath = workDir.resolve(STAGED_FILE_NAME);
        Files.writeString(manifestPath, buildManifest(segments), StandardCharsets.UTF_8);

        try {
            commandRunner.run(buildConcatArguments(manifestPath, stagedPath), "stitch " + segments.size() + " segments");
        } catch (IOException e) {
            Files.deleteIfExists(stagedPath);
            throw new ConcatenationException("Stream-copy concatenation failed: " + e.getMessage(), e);
        }

        Path parent = artifactPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.move(stagedPath, artifactPath, StandardCopyOption.REPLACE_EXISTING);
        logger.info("Stitched {} segments into {}", segments.size(), artifactPath);
        return artifactPath;
    }

    String buildManifest(List<RenderedSegment> segments) {
        StringBuilder manifest = new StringBuilder();
        for (RenderedSegment segment : segments) {
            String absolutePath = segment.path().toAbsolutePath().normalize().toString();
            manifest.append("file '")
                    .append(absolutePath.replace("'", "'\\''"))
                    .append("'\n");
        }
        return manifest.toString();
    }

    List<String> buildConcatArguments(Path manifestPath, Path outputPath) {
        return List.of(
                "-y",
                "-f",
                "concat",
                "-safe",
                "0",
                "-i",
                manifestPath.toString(),
                "-c",
                "copy",
                outputPath.toString());
    }
}
