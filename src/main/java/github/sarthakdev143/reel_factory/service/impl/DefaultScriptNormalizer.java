package github.sarthakdev143.reel_factory.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.reel_factory.exception.ScriptGenerationException;
import github.sarthakdev143.reel_factory.integration.script.TextGenerationClient;
import github.sarthakdev143.reel_factory.model.ContentCategory;
import github.sarthakdev143.reel_factory.model.LengthMode;
import github.sarthakdev143.reel_factory.model.NarrationSet;
import github.sarthakdev143.reel_factory.model.SceneDescriptor;
import github.sarthakdev143.reel_factory.service.ScriptNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Asks the text-generation service for a script and turns its reply into a {@link NarrationSet} with one
 * item per scene.
 */
@Service
public class DefaultScriptNormalizer implements ScriptNormalizer {

    static final String FILLER_NARRATION = "Here is another pick worth your attention.";

    private static final Logger logger = LoggerFactory.getLogger(DefaultScriptNormalizer.class);
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?", Pattern.CASE_INSENSITIVE);
    private static final List<String> SPOKEN_TEXT_FIELDS = List.of(
            "script",
            "narration",
            "spoken_text",
            "text",
            "details");

    private final TextGenerationClient textGenerationClient;
    private final ScriptPromptBuilder promptBuilder;
    private final ObjectMapper objectMapper;

    public DefaultScriptNormalizer(
            TextGenerationClient textGenerationClient,
            ScriptPromptBuilder promptBuilder,
            ObjectMapper objectMapper) {
        this.textGenerationClient = textGenerationClient;
        this.promptBuilder = promptBuilder;
        this.objectMapper = objectMapper;
    }

    @Override
    public NarrationSet generate(
            String topic,
            ContentCategory category,
            LengthMode lengthMode,
            List<SceneDescriptor> scenes) {
        String prompt = promptBuilder.build(topic, category, lengthMode, scenes);

        String raw;
        try {
            raw = textGenerationClient.complete(prompt);
        } catch (IOException e) {
            throw new ScriptGenerationException("Script generation request failed: " + e.getMessage(), null, e);
        }

        NarrationSet narration = normalize(raw, scenes.size());
        logger.info(
                "Generated script for topic '{}' with {} items for {} scenes",
                topic,
                narration.items().size(),
                scenes.size());
        return narration;
    }

    NarrationSet normalize(String raw, int sceneCount) {
        String cleaned = raw == null ? "" : CODE_FENCE.matcher(raw).replaceAll("").trim();

        JsonNode root;
        try {
            root = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            throw new ScriptGenerationException("Script response is not valid JSON.", raw, e);
        }
        if (root == null || !root.isObject()) {
            throw new ScriptGenerationException("Script response is not a JSON object.", raw);
        }

        List<String> items = new ArrayList<>();
        JsonNode itemsNode = root.get("items");
        if (itemsNode != null && itemsNode.isArray()) {
            for (JsonNode item : itemsNode) {
                String spoken = spokenText(item);
                items.add(spoken.isEmpty() ? FILLER_NARRATION : spoken);
            }
        }

        int padded = 0;
        while (items.size() < sceneCount) {
            items.add(FILLER_NARRATION);
            padded++;
        }
        if (padded > 0) {
            logger.warn("Script returned {} items for {} scenes; padded with filler", sceneCount - padded, sceneCount);
        }

        return new NarrationSet(spokenText(root.get("intro")), items, spokenText(root.get("outro")));
    }

    /**
     * Reads narration from either a plain string or an object such as {@code {"title": ..., "script": ...}}.
     * Returns an empty string when the node carries nothing speakable.
     */
    private String spokenText(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isTextual()) {
            return node.asText().trim();
        }
        if (!node.isObject()) {
            return "";
        }

        for (String field : SPOKEN_TEXT_FIELDS) {
            String value = textField(node, field);
            if (!value.isEmpty()) {
                return value;
            }
        }
        return textField(node, "title");
    }

    private String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            return "";
        }
        return value.asText().trim();
    }
}
