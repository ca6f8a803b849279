package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.model.ContentCategory;
import github.sarthakdev143.reel_factory.model.LengthMode;
import github.sarthakdev143.reel_factory.model.SceneDescriptor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ScriptPromptBuilder {

    private static final int MIN_DETAILS_LENGTH = 5;

    public String build(String topic, ContentCategory category, LengthMode lengthMode, List<SceneDescriptor> scenes) {
        StringBuilder itemsContext = new StringBuilder();
        for (int index = 0; index < scenes.size(); index++) {
            SceneDescriptor scene = scenes.get(index);
            itemsContext.append("\n--- ITEM ")
                    .append(index + 1)
                    .append(": ")
                    .append(scene.name())
                    .append(" ---\n")
                    .append(instructionFor(scene))
                    .append('\n');
        }

        return category.persona() + "\n"
                + "Topic: \"" + topic + "\"\n"
                + "Tone: " + category.tone() + "\n"
                + "Constraint: " + lengthMode.lengthConstraint() + "\n"
                + "\n"
                + "TASK:\n"
                + "Create a spoken script for a video.\n"
                + "\n"
                + "STRICT RULES:\n"
                + "1. If the user provided details, you MUST say them.\n"
                + "2. If the user provided nothing, you MUST provide value.\n"
                + "3. Do not sound robotic.\n"
                + "4. \"items\" MUST contain exactly " + scenes.size() + " strings, one per item, in the order given.\n"
                + "\n"
                + "INPUT DATA:\n"
                + itemsContext
                + "\n"
                + "RETURN ONLY JSON:\n"
                + "{\n"
                + "  \"intro\": \"A strong hook.\",\n"
                + "  \"items\": [\n"
                + "    \"Script for Item 1\",\n"
                + "    \"Script for Item 2\"\n"
                + "  ],\n"
                + "  \"outro\": \"A strong conclusion.\"\n"
                + "}\n";
    }

    private String instructionFor(SceneDescriptor scene) {
        if (scene.details().length() < MIN_DETAILS_LENGTH) {
            return "User provided NO details. You MUST fetch facts (Year, Cast, Specs) from your own knowledge.";
        }
        return "User provided: '" + scene.details() + "'. YOU MUST WEAVE THESE EXACT DETAILS into the script.";
    }
}
