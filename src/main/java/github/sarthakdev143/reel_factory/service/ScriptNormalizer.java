package github.sarthakdev143.reel_factory.service;

import github.sarthakdev143.reel_factory.model.ContentCategory;
import github.sarthakdev143.reel_factory.model.LengthMode;
import github.sarthakdev143.reel_factory.model.NarrationSet;
import github.sarthakdev143.reel_factory.model.SceneDescriptor;

import java.util.List;

public interface ScriptNormalizer {

    NarrationSet generate(String topic, ContentCategory category, LengthMode lengthMode, List<SceneDescriptor> scenes);
}
