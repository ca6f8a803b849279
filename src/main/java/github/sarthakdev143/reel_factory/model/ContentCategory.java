package github.sarthakdev143.reel_factory.model;

import java.util.Locale;

public enum ContentCategory {
    MOVIE("You are an enthusiastic Movie Critic.", "passionate, dramatic, and opinionated", true),
    PRODUCT("You are a persuasive Sales Copywriter.", "excited, convincing, and highlighting value", false),
    GENERAL("You are a professional video scriptwriter.", "engaging and clear", false);

    private final String persona;
    private final String tone;
    private final boolean posterLookup;

    ContentCategory(String persona, String tone, boolean posterLookup) {
        this.persona = persona;
        this.tone = tone;
        this.posterLookup = posterLookup;
    }

    public static ContentCategory fromInput(String input) {
        if (input == null || input.isBlank()) {
            return GENERAL;
        }

        try {
            return ContentCategory.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return GENERAL;
        }
    }

    public String persona() {
        return persona;
    }

    public String tone() {
        return tone;
    }

    public boolean supportsPosterLookup() {
        return posterLookup;
    }
}
