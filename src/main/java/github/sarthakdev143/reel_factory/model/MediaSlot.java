package github.sarthakdev143.reel_factory.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A named position in the final video. Slots sort intro first, then scenes by index, then outro.
 */
public record MediaSlot(SlotKind kind, int sceneIndex) implements Comparable<MediaSlot> {

    private static final MediaSlot INTRO = new MediaSlot(SlotKind.INTRO, -1);
    private static final MediaSlot OUTRO = new MediaSlot(SlotKind.OUTRO, -1);

    public MediaSlot {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required.");
        }
        if (kind == SlotKind.SCENE && sceneIndex < 0) {
            throw new IllegalArgumentException("sceneIndex must be >= 0 for scene slots.");
        }
        if (kind != SlotKind.SCENE) {
            sceneIndex = -1;
        }
    }

    public static MediaSlot intro() {
        return INTRO;
    }

    public static MediaSlot outro() {
        return OUTRO;
    }

    public static MediaSlot scene(int index) {
        return new MediaSlot(SlotKind.SCENE, index);
    }

    public static List<MediaSlot> forSceneCount(int sceneCount) {
        List<MediaSlot> slots = new ArrayList<>(sceneCount + 2);
        slots.add(INTRO);
        for (int index = 0; index < sceneCount; index++) {
            slots.add(scene(index));
        }
        slots.add(OUTRO);
        return slots;
    }

    /**
     * Multipart field name a caller uses to upload media for this slot.
     */
    public String formKey() {
        return "media_" + key();
    }

    public String key() {
        return switch (kind) {
            case INTRO -> "intro";
            case OUTRO -> "outro";
            case SCENE -> String.valueOf(sceneIndex);
        };
    }

    private int order() {
        return switch (kind) {
            case INTRO -> -1;
            case SCENE -> sceneIndex;
            case OUTRO -> Integer.MAX_VALUE;
        };
    }

    @Override
    public int compareTo(MediaSlot other) {
        return Integer.compare(order(), other.order());
    }

    @Override
    public String toString() {
        return kind == SlotKind.SCENE ? "scene[" + sceneIndex + "]" : key();
    }
}
