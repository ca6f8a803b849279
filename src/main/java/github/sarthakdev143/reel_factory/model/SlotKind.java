package github.sarthakdev143.reel_factory.model;

public enum SlotKind {
    INTRO,
    SCENE,
    OUTRO
}
