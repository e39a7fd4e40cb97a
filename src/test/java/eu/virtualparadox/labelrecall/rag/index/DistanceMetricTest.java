package eu.virtualparadox.labelrecall.rag.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class DistanceMetricTest {

    @Test
    @DisplayName("Cosine treats a zero vector as orthogonal to everything")
    void zeroVectorIsOrthogonal() {
        assertThat(DistanceMetric.COSINE.distance(new float[]{0f, 0f}, new float[]{1f, 0f})).isEqualTo(1.0f);
        assertThat(DistanceMetric.COSINE.distance(new float[]{1f, 0f}, new float[]{0f, 0f})).isEqualTo(1.0f);
        assertThat(DistanceMetric.COSINE.distance(new float[]{0f, 0f}, new float[]{0f, 0f})).isEqualTo(1.0f);
        assertThat(DistanceMetric.COSINE.toScore(1.0f)).isZero();
    }

    @Test
    @DisplayName("Cosine ignores vector length")
    void cosineIgnoresLength() {
        assertThat(DistanceMetric.COSINE.distance(new float[]{3f, 4f}, new float[]{0.6f, 0.8f}))
                .isCloseTo(0f, offset(1e-6f));
        assertThat(DistanceMetric.COSINE.distance(new float[]{1f, 0f}, new float[]{-2f, 0f}))
                .isCloseTo(2f, offset(1e-6f));
    }

    @ParameterizedTest
    @EnumSource(value = DistanceMetric.class, names = {"L2", "DOT"})
    @DisplayName("Only cosine rejects zero vectors")
    void zeroVectorSupport(final DistanceMetric metric) {
        assertThat(metric.supports(new float[]{0f, 0f})).isTrue();
        assertThat(DistanceMetric.COSINE.supports(new float[]{0f, 0f})).isFalse();
        assertThat(DistanceMetric.COSINE.supports(new float[]{0f, 1e-3f})).isTrue();
    }

    @Test
    @DisplayName("Scores grow as distances shrink")
    void scoresFollowDistance() {
        assertThat(DistanceMetric.L2.toScore(0f)).isEqualTo(1f);
        assertThat(DistanceMetric.L2.toScore(1f)).isEqualTo(0.5f);
        assertThat(DistanceMetric.DOT.toScore(DistanceMetric.DOT.distance(new float[]{1f, 2f}, new float[]{3f, 4f})))
                .isEqualTo(11f);
    }
}
