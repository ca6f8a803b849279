package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.config.ReelFactoryProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits narration into pieces the speech provider accepts in one request.
 *
 * <p>Text is cut into sentences at terminal punctuation. A sentence that fits the limit is one chunk; a longer
 * one is packed word by word. Words are never split unless a single word is longer than the limit.
 */
@Component
public class NarrationChunker {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxChunkChars;

    @Autowired
    public NarrationChunker(ReelFactoryProperties properties) {
        this(properties.speech().maxChunkChars());
    }

    public NarrationChunker(int maxChunkChars) {
        if (maxChunkChars <= 0) {
            throw new IllegalArgumentException("maxChunkChars must be greater than 0.");
        }
        this.maxChunkChars = maxChunkChars;
    }

    public List<String> chunk(String text) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return chunks;
        }

        for (String unit : SENTENCE_BOUNDARY.split(text.trim())) {
            String sentence = unit.trim();
            if (sentence.isEmpty()) {
                continue;
            }
            if (sentence.length() <= maxChunkChars) {
                chunks.add(sentence);
            } else {
                packWords(sentence, chunks);
            }
        }
        return chunks;
    }

    private void packWords(String sentence, List<String> chunks) {
        StringBuilder current = new StringBuilder();
        for (String word : WHITESPACE.split(sentence)) {
            if (word.isEmpty()) {
                continue;
            }
            if (word.length() > maxChunkChars) {
                flush(current, chunks);
                splitOversizedWord(word, chunks);
                continue;
            }

            int projectedLength = current.length() == 0
                    ? word.length()
                    : current.length() + 1 + word.length();
            if (projectedLength > maxChunkChars) {
                flush(current, chunks);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(word);
        }
        flush(current, chunks);
    }

    private void splitOversizedWord(String word, List<String> chunks) {
        for (int start = 0; start < word.length(); start += maxChunkChars) {
            chunks.add(word.substring(start, Math.min(word.length(), start + maxChunkChars)));
        }
    }

    private void flush(StringBuilder current, List<String> chunks) {
        if (current.length() > 0) {
            chunks.add(current.toString());
            current.setLength(0);
        }
    }
}
