package github.sarthakdev143.reel_factory.model;

public record SceneDescriptor(String name, String details) {

    public SceneDescriptor {
        name = name == null ? "" : name.trim();
        details = details == null ? "" : details.trim();
    }
}
