package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.exception.MediaResolutionException;
import github.sarthakdev143.reel_factory.integration.media.MediaSearchClient;
import github.sarthakdev143.reel_factory.integration.media.PlaceholderImageGenerator;
import github.sarthakdev143.reel_factory.integration.media.RemoteFileDownloader;
import github.sarthakdev143.reel_factory.model.LengthMode;
import github.sarthakdev143.reel_factory.model.MediaSlot;
import github.sarthakdev143.reel_factory.model.VisualKind;
import github.sarthakdev143.reel_factory.model.VisualSource;
import github.sarthakdev143.reel_factory.service.MediaResolver;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Service
public class DefaultMediaResolver implements MediaResolver {

    static final String DEFAULT_LABEL = "Scene";

    private static final Logger logger = LoggerFactory.getLogger(DefaultMediaResolver.class);
    private static final Set<String> VIDEO_EXTENSIONS = Set.of(".mp4", ".mov", ".avi", ".mkv", ".webm");
    private static final Pattern SAFE_EXTENSION = Pattern.compile("\\.[a-z0-9]{1,8}");
    private static final String DEFAULT_EXTENSION = ".jpg";

    private final MediaSearchClient mediaSearchClient;
    private final RemoteFileDownloader downloader;
    private final List<PlaceholderImageGenerator> placeholderGenerators;
    private final MeterRegistry meterRegistry;

    public DefaultMediaResolver(
            MediaSearchClient mediaSearchClient,
            RemoteFileDownloader downloader,
            List<PlaceholderImageGenerator> placeholderGenerators,
            MeterRegistry meterRegistry) {
        this.mediaSearchClient = mediaSearchClient;
        this.downloader = downloader;
        this.placeholderGenerators = List.copyOf(placeholderGenerators);
        this.meterRegistry = meterRegistry;
    }

    @Override
    public VisualSource resolve(
            MediaSlot slot,
            String fallbackLabel,
            boolean lookupEnabled,
            MultipartFile upload,
            LengthMode lengthMode,
            Path workDir) {
        String stem = "media_" + slot.key();

        if (upload != null && !upload.isEmpty()) {
            try {
                return persistUpload(upload, workDir, stem);
            } catch (IOException e) {
                logger.warn("Could not store upload for {}, falling back: {}", slot, e.getMessage());
            }
        }

        String label = fallbackLabel == null || fallbackLabel.isBlank() ? DEFAULT_LABEL : fallbackLabel.trim();

        if (lookupEnabled && fallbackLabel != null && !fallbackLabel.isBlank()) {
            try {
                VisualSource found = lookup(label, workDir.resolve(stem + DEFAULT_EXTENSION));
                if (found != null) {
                    recordSource("lookup");
                    logger.info("Resolved {} from media search for '{}'", slot, label);
                    return found;
                }
                logger.warn("Media search returned nothing for {} ('{}')", slot, label);
            } catch (IOException e) {
                logger.warn("Media search failed for {} ('{}'): {}", slot, label, e.getMessage());
            }
        }

        return placeholder(slot, label, lengthMode, workDir.resolve(stem + "-placeholder.png"));
    }

    private VisualSource persistUpload(MultipartFile upload, Path workDir, String stem) throws IOException {
        String extension = extensionOf(upload.getOriginalFilename());
        Path target = workDir.resolve(stem + extension);
        upload.transferTo(target);

        VisualKind kind = isVideo(extension, upload.getContentType()) ? VisualKind.VIDEO : VisualKind.IMAGE;
        recordSource("upload");
        return new VisualSource(target, kind);
    }

    private VisualSource lookup(String query, Path target) throws IOException {
        List<URI> results = mediaSearchClient.search(query);
        if (results.isEmpty()) {
            return null;
        }
        downloader.download(results.get(0), target);
        return new VisualSource(target, VisualKind.IMAGE);
    }

    private VisualSource placeholder(MediaSlot slot, String label, LengthMode lengthMode, Path target) {
        IOException lastError = null;
        for (PlaceholderImageGenerator generator : placeholderGenerators) {
            try {
                generator.generate(label, lengthMode.width(), lengthMode.height(), target);
                recordSource(generator.source());
                logger.info("Using {} image for {}", generator.source(), slot);
                return new VisualSource(target, VisualKind.IMAGE);
            } catch (IOException e) {
                lastError = e;
                deleteIfExists(target);
                logger.warn("Placeholder source {} failed for {}: {}", generator.source(), slot, e.getMessage());
            }
        }
        throw new MediaResolutionException("No visual could be produced for " + slot, lastError);
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return DEFAULT_EXTENSION;
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0) {
            return DEFAULT_EXTENSION;
        }
        String extension = filename.substring(dot).toLowerCase(Locale.ROOT);
        return SAFE_EXTENSION.matcher(extension).matches() ? extension : DEFAULT_EXTENSION;
    }

    static boolean isVideo(String extension, String contentType) {
        if (VIDEO_EXTENSIONS.contains(extension)) {
            return true;
        }
        return contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("video/");
    }

    private void recordSource(String source) {
        meterRegistry.counter("reel_factory.media.fallbacks", "source", source).increment();
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
