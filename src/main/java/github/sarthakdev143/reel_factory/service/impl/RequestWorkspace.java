package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.model.MediaSlot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Per-request scratch directory under the work root. Closing it removes everything inside.
 */
final class RequestWorkspace implements AutoCloseable {

    private final Path directory;

    private RequestWorkspace(Path directory) {
        this.directory = directory;
    }

    static RequestWorkspace open(Path workRoot, String requestId) throws IOException {
        Path directory = workRoot.resolve(requestId);
        Files.createDirectories(directory);
        return new RequestWorkspace(directory);
    }

    Path directory() {
        return directory;
    }

    Path resolve(String name) {
        return directory.resolve(name);
    }

    Path segmentPath(MediaSlot slot) {
        return directory.resolve("seg_" + slot.key() + ".mp4");
    }

    @Override
    public void close() {
        try {
            if (Files.notExists(directory)) {
                return;
            }

            try (var pathStream = Files.walk(directory)) {
                pathStream
                        .sorted((left, right) -> right.compareTo(left))
                        .forEach(RequestWorkspace::deleteIfExists);
            }
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }

    private static void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
