package github.sarthakdev143.reel_factory.model;

import java.util.Locale;

public enum LengthMode {
    SHORT(1080, 1920, "Write about 2-3 sentences per item. Keep it fast."),
    LONG(1920, 1080, "Write a detailed paragraph (4-5 sentences) per item.");

    private final int width;
    private final int height;
    private final String lengthConstraint;

    LengthMode(int width, int height, String lengthConstraint) {
        this.width = width;
        this.height = height;
        this.lengthConstraint = lengthConstraint;
    }

    public static LengthMode fromInput(String input) {
        if (input == null || input.isBlank()) {
            return SHORT;
        }

        try {
            return LengthMode.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("type must be one of short, long.");
        }
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public String lengthConstraint() {
        return lengthConstraint;
    }

    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
