package fr.lapetina.ensemble.orchestrator.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SweepSpecTest {

    @Nested
    @DisplayName("Axis")
    class AxisTests {

        @Test
        @DisplayName("should round accumulated float error to three decimals")
        void shouldRoundToThreeDecimals() {
            SweepSpec.Axis axis = new SweepSpec.Axis(0.05, 0.05, 10);

            // 0.05 + 2 * 0.05 is 0.15000000000000002 in binary floating point
            assertThat(axis.valueAt(2)).isEqualTo(0.15);
            assertThat(axis.valueAt(9)).isEqualTo(0.5);
        }

        @Test
        @DisplayName("should produce the default feed rate values")
        void shouldProduceDefaultFeedRates() {
            SweepSpec.Axis axis = SweepSpec.defaults().feedRate();

            double[] values = new double[axis.count()];
            for (int i = 0; i < axis.count(); i++) {
                values[i] = axis.valueAt(i);
            }

            assertThat(values).containsExactly(0.01, 0.02, 0.03, 0.04, 0.05, 0.06, 0.07, 0.08, 0.09, 0.1);
        }

        @Test
        @DisplayName("should drop digits beyond the precision")
        void shouldDropExtraDigits() {
            SweepSpec.Axis axis = new SweepSpec.Axis(0.0, 0.0004, 3);

            assertThat(axis.valueAt(1)).isEqualTo(0.0);
            assertThat(axis.valueAt(2)).isEqualTo(0.001);
        }

        @Test
        @DisplayName("should reject negative counts")
        void shouldRejectNegativeCount() {
            assertThatThrownBy(() -> new SweepSpec.Axis(0.1, 0.1, -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject indices outside the axis")
        void shouldRejectOutOfRangeIndex() {
            SweepSpec.Axis axis = new SweepSpec.Axis(0.1, 0.1, 2);

            assertThatThrownBy(() -> axis.valueAt(2)).isInstanceOf(IndexOutOfBoundsException.class);
        }
    }

    @Test
    @DisplayName("should format values with at least one fractional digit")
    void shouldFormatCanonically() {
        assertThat(SweepSpec.format(0.1)).isEqualTo("0.1");
        assertThat(SweepSpec.format(0.05)).isEqualTo("0.05");
        assertThat(SweepSpec.format(0.001)).isEqualTo("0.001");
        assertThat(SweepSpec.format(1.0)).isEqualTo("1.0");
        assertThat(SweepSpec.format(0.0)).isEqualTo("0.0");
        assertThat(SweepSpec.format(12.5)).isEqualTo("12.5");
        assertThat(SweepSpec.format(100.0)).isEqualTo("100.0");
    }

    @Test
    @DisplayName("should size the grid as the product of both axes")
    void shouldComputeSize() {
        assertThat(SweepSpec.defaults().size()).isEqualTo(100);
        assertThat(new SweepSpec(new SweepSpec.Axis(0, 1, 3), new SweepSpec.Axis(0, 1, 0)).size()).isZero();
    }
}
