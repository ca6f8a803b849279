package github.sarthakdev143.reel_factory.model;

public enum VisualKind {
    IMAGE,
    VIDEO
}
