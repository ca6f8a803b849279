package github.sarthakdev143.reel_factory.model;

import java.util.List;

/**
 * Narration for one request after normalization. {@code items} holds at least one entry per scene;
 * entries past the scene count are kept but never rendered.
 */
public record NarrationSet(String intro, List<String> items, String outro) {

    public NarrationSet {
        intro = intro == null ? "" : intro;
        items = items == null ? List.of() : List.copyOf(items);
        outro = outro == null ? "" : outro;
    }

    public String narrationFor(MediaSlot slot) {
        return switch (slot.kind()) {
            case INTRO -> intro;
            case OUTRO -> outro;
            case SCENE -> slot.sceneIndex() < items.size() ? items.get(slot.sceneIndex()) : "";
        };
    }
}
