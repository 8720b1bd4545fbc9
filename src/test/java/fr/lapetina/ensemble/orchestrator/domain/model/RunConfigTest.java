package fr.lapetina.ensemble.orchestrator.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunConfigTest {

    @Test
    @DisplayName("should overwrite sweep keys in their template position")
    void shouldOverwriteSweepKeysInPlace() {
        Map<String, Object> template = new LinkedHashMap<>();
        template.put("L", 128);
        template.put("F", 0.02);
        template.put("k", 0.048);
        template.put("Du", 0.2);

        RunConfig config = RunConfig.fromTemplate(template).withSweepPoint(0.01, 0.05);

        assertThat(config.toMap())
                .containsExactly(
                        Map.entry("L", 128),
                        Map.entry("F", 0.01),
                        Map.entry("k", 0.05),
                        Map.entry("Du", 0.2));
    }

    @Test
    @DisplayName("should append sweep keys missing from the template")
    void shouldAppendMissingSweepKeys() {
        Map<String, Object> template = new LinkedHashMap<>();
        template.put("steps", 1000);
        template.put("output", null);

        RunConfig config = RunConfig.fromTemplate(template).withSweepPoint(0.02, 0.1);

        assertThat(config.toMap().keySet()).containsExactly("steps", "output", "F", "k");
        assertThat(config.toMap()).containsEntry("output", null);
    }

    @Test
    @DisplayName("should leave the template untouched when applying a sweep point")
    void shouldNotMutateTemplate() {
        RunConfig template = RunConfig.fromTemplate(Map.of("F", 0.5, "k", 0.5));

        RunConfig point = template.withSweepPoint(0.01, 0.05);

        assertThat(template.feedRate()).isEqualTo(0.5);
        assertThat(point.feedRate()).isEqualTo(0.01);
        assertThat(point.killRate()).isEqualTo(0.05);
    }

    @Test
    @DisplayName("should expose parameters read-only")
    void shouldExposeReadOnlyParameters() {
        RunConfig config = RunConfig.fromTemplate(Map.of("L", 64));

        assertThatThrownBy(() -> config.parameters().put("L", 32))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
