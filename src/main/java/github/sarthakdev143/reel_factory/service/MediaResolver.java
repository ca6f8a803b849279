package github.sarthakdev143.reel_factory.service;

import github.sarthakdev143.reel_factory.model.LengthMode;
import github.sarthakdev143.reel_factory.model.MediaSlot;
import github.sarthakdev143.reel_factory.model.VisualSource;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;

public interface MediaResolver {

    /**
     * Picks the visual for one slot: the caller's upload, then an external lookup of {@code fallbackLabel}
     * when {@code lookupEnabled}, then a generated placeholder. The file is written into {@code workDir}.
     *
     * @param upload the caller's file for this slot, or {@code null}
     */
    VisualSource resolve(
            MediaSlot slot,
            String fallbackLabel,
            boolean lookupEnabled,
            MultipartFile upload,
            LengthMode lengthMode,
            Path workDir);
}
