package github.sarthakdev143.reel_factory.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MediaSlotTest {

    @Test
    void forSceneCountListsIntroScenesOutro() {
        assertThat(MediaSlot.forSceneCount(2)).containsExactly(
                MediaSlot.intro(), MediaSlot.scene(0), MediaSlot.scene(1), MediaSlot.outro());
    }

    @Test
    void sortsIntroFirstAndOutroLast() {
        List<MediaSlot> slots = new ArrayList<>(List.of(
                MediaSlot.outro(), MediaSlot.scene(10), MediaSlot.intro(), MediaSlot.scene(2)));

        Collections.sort(slots);

        assertThat(slots).containsExactly(
                MediaSlot.intro(), MediaSlot.scene(2), MediaSlot.scene(10), MediaSlot.outro());
    }

    @Test
    void formKeysMatchMultipartFieldNames() {
        assertThat(MediaSlot.intro().formKey()).isEqualTo("media_intro");
        assertThat(MediaSlot.scene(3).formKey()).isEqualTo("media_3");
        assertThat(MediaSlot.outro().formKey()).isEqualTo("media_outro");
        assertThat(MediaSlot.scene(3)).hasToString("scene[3]");
    }

    @Test
    void rejectsNegativeSceneIndex() {
        assertThatThrownBy(() -> MediaSlot.scene(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
