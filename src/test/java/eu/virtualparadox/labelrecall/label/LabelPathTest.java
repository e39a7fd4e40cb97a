package eu.virtualparadox.labelrecall.label;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LabelPathTest {

    @Test
    @DisplayName("External form splits on ## and trims levels")
    void parsesExternalForm() {
        final LabelPath path = LabelPath.parse(" 体育 ## 篮球 ");

        assertThat(path.levels()).containsExactly("体育", "篮球");
        assertThat(path.depth()).isEqualTo(2);
        assertThat(path.root()).isEqualTo("体育");
        assertThat(path.leaf()).isEqualTo("篮球");
        assertThat(path.asString()).isEqualTo("体育##篮球");
    }

    @Test
    @DisplayName("A single level is a valid path")
    void singleLevel() {
        assertThat(LabelPath.parse("教育")).isEqualTo(LabelPath.of("教育"));
    }

    @Test
    @DisplayName("Blank paths and empty levels are rejected")
    void rejectsInvalidPaths() {
        assertThatThrownBy(() -> LabelPath.parse("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LabelPath.parse("体育##")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LabelPath.parse("##篮球")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LabelPath(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LabelPath.of("a\tb")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Later changes to the source list do not leak into the path")
    void copiesLevels() {
        final List<String> levels = new ArrayList<>(List.of("sports", "tennis"));
        final LabelPath path = new LabelPath(levels);
        levels.add("wimbledon");

        assertThat(path.depth()).isEqualTo(2);
    }

    @Test
    @DisplayName("Truncation keeps the first levels and ignores out-of-range depths")
    void truncates() {
        final LabelPath path = LabelPath.of("sports", "ball", "basketball");

        assertThat(path.truncate(1)).isEqualTo(LabelPath.of("sports"));
        assertThat(path.truncate(2)).isEqualTo(LabelPath.of("sports", "ball"));
        assertThat(path.truncate(0)).isSameAs(path);
        assertThat(path.truncate(5)).isSameAs(path);
    }

    @Test
    @DisplayName("Ordering is lexicographic on the joined form")
    void ordersLexicographically() {
        assertThat(LabelPath.of("a", "b").compareTo(LabelPath.of("b"))).isNegative();
        assertThat(LabelPath.of("a").compareTo(LabelPath.of("a", "b"))).isNegative();
    }
}
