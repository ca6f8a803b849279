package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.exception.SegmentRenderException;
import github.sarthakdev143.reel_factory.integration.speech.SpeechSynthesisClient;
import github.sarthakdev143.reel_factory.service.SpeechSynthesizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Synthesizes narration chunk by chunk and appends the returned mp3 bytes, in text order, to one file.
 * MP3 frames are self-delimiting, so the appended stream plays as one continuous track.
 *
 * <p>A chunk that fails is logged and left out. The segment only fails when nothing was written.
 */
@Service
public class ChunkedSpeechSynthesizer implements SpeechSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(ChunkedSpeechSynthesizer.class);

    private final NarrationChunker chunker;
    private final SpeechSynthesisClient speechClient;
    private final Counter chunkFailureCounter;

    public ChunkedSpeechSynthesizer(
            NarrationChunker chunker,
            SpeechSynthesisClient speechClient,
            MeterRegistry meterRegistry) {
        this.chunker = chunker;
        this.speechClient = speechClient;
        this.chunkFailureCounter = meterRegistry.counter("reel_factory.speech.chunk_failures");
    }

    @Override
    public void synthesize(String text, Path outputPath) throws IOException {
        List<String> chunks = chunker.chunk(text);
        int failedChunks = 0;

        try (OutputStream output = Files.newOutputStream(
                outputPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            for (int index = 0; index < chunks.size(); index++) {
                String chunk = chunks.get(index);
                byte[] audio;
                try {
                    audio = speechClient.synthesize(chunk);
                } catch (IOException chunkError) {
                    failedChunks++;
                    chunkFailureCounter.increment();
                    logger.warn(
                            "Skipping narration chunk {}/{} ({} chars): {}",
                            index + 1,
                            chunks.size(),
                            chunk.length(),
                            chunkError.getMessage());
                    continue;
                }
                output.write(audio);
            }
        }

        if (Files.size(outputPath) == 0) {
            Files.deleteIfExists(outputPath);
            throw new SegmentRenderException(
                    "Speech synthesis produced no audio ("
                            + failedChunks
                            + " of "
                            + chunks.size()
                            + " chunks failed).");
        }

        if (failedChunks > 0) {
            logger.warn("Narration written with {} of {} chunks missing to {}", failedChunks, chunks.size(), outputPath);
        }
    }
}
