package github.sarthakdev143.reel_factory.model;

import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

public record ReelRequest(
        String topic,
        ContentCategory category,
        LengthMode lengthMode,
        List<SceneDescriptor> scenes,
        Map<String, MultipartFile> uploads) {

    public ReelRequest {
        topic = topic == null ? "" : topic.trim();
        category = category == null ? ContentCategory.GENERAL : category;
        lengthMode = lengthMode == null ? LengthMode.SHORT : lengthMode;
        scenes = scenes == null ? List.of() : List.copyOf(scenes);
        uploads = uploads == null ? Map.of() : Map.copyOf(uploads);
    }
}
