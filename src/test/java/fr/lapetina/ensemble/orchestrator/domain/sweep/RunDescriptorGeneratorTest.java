package fr.lapetina.ensemble.orchestrator.domain.sweep;

import fr.lapetina.ensemble.orchestrator.domain.model.RunConfig;
import fr.lapetina.ensemble.orchestrator.domain.model.SweepSpec;
import fr.lapetina.ensemble.orchestrator.domain.model.WorkItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunDescriptorGeneratorTest {

    @TempDir
    Path ensembleRoot;

    private RunDescriptorGenerator generator;
    private RunConfig template;

    @BeforeEach
    void setUp() {
        generator = new RunDescriptorGenerator();
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("L", 128);
        parameters.put("F", 0.0);
        parameters.put("k", 0.0);
        parameters.put("noise", 0.01);
        template = RunConfig.fromTemplate(parameters);
    }

    @Test
    @DisplayName("should name directories after rounded grid values")
    void shouldNameDirectoriesAfterGridValues() {
        SweepSpec spec = new SweepSpec(new SweepSpec.Axis(0.01, 0.01, 2), new SweepSpec.Axis(0.05, 0.05, 2));

        List<String> names = drain(generator.generate(template, spec, ensembleRoot)).stream()
                .map(WorkItem::name)
                .toList();

        assertThat(names).containsExactly("F_0.01-k_0.05", "F_0.01-k_0.1", "F_0.02-k_0.05", "F_0.02-k_0.1");
    }

    @Test
    @DisplayName("should overwrite sweep keys and pass other keys through")
    void shouldOverwriteSweepKeys() {
        SweepSpec spec = new SweepSpec(new SweepSpec.Axis(0.03, 0.01, 1), new SweepSpec.Axis(0.15, 0.05, 1));

        WorkItem item = generator.generate(template, spec, ensembleRoot).next();

        assertThat(item.directory()).isEqualTo(ensembleRoot.resolve("F_0.03-k_0.15"));
        assertThat(item.config().feedRate()).isEqualTo(0.03);
        assertThat(item.config().killRate()).isEqualTo(0.15);
        assertThat(item.config().toMap()).containsEntry("L", 128).containsEntry("noise", 0.01);
    }

    @Test
    @DisplayName("should yield the full grid minus existing directories")
    void shouldSkipExistingDirectories() throws IOException {
        SweepSpec spec = SweepSpec.defaults();
        Files.createDirectory(ensembleRoot.resolve("F_0.01-k_0.05"));
        Files.createDirectory(ensembleRoot.resolve("F_0.05-k_0.25"));
        Files.createDirectory(ensembleRoot.resolve("F_0.1-k_0.5"));
        Files.createDirectory(ensembleRoot.resolve("unrelated"));

        SweepEnumeration enumeration = generator.generate(template, spec, ensembleRoot);
        List<WorkItem> items = drain(enumeration);

        assertThat(items).hasSize(97);
        assertThat(enumeration.getGeneratedCount()).isEqualTo(97);
        assertThat(enumeration.getSkippedCount()).isEqualTo(3);
        assertThat(enumeration.getGeneratedCount() + enumeration.getSkippedCount()).isEqualTo(spec.size());
        assertThat(items).extracting(WorkItem::name).doesNotContain("F_0.01-k_0.05", "F_0.1-k_0.5");
    }

    @Test
    @DisplayName("should yield nothing on a second pass once every directory exists")
    void shouldBeIdempotent() throws IOException {
        SweepSpec spec = SweepSpec.defaults();
        for (WorkItem item : drain(generator.generate(template, spec, ensembleRoot))) {
            Files.createDirectory(item.directory());
        }

        SweepEnumeration second = generator.generate(template, spec, ensembleRoot);

        assertThat(second.hasNext()).isFalse();
        assertThat(second.getSkippedCount()).isEqualTo(100);
    }

    @Test
    @DisplayName("should never yield two items with the same directory")
    void shouldYieldUniqueDirectories() {
        List<WorkItem> items = drain(generator.generate(template, SweepSpec.defaults(), ensembleRoot));

        assertThat(items).hasSize(100);
        assertThat(items).extracting(WorkItem::directory).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("should not write anything to the ensemble root")
    void shouldNotWrite() throws IOException {
        drain(generator.generate(template, SweepSpec.defaults(), ensembleRoot));

        try (Stream<Path> entries = Files.list(ensembleRoot)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    @DisplayName("should throw once exhausted")
    void shouldThrowWhenExhausted() {
        SweepSpec spec = new SweepSpec(new SweepSpec.Axis(0.01, 0.01, 1), new SweepSpec.Axis(0.05, 0.05, 0));

        SweepEnumeration enumeration = generator.generate(template, spec, ensembleRoot);

        assertThat(enumeration.hasNext()).isFalse();
        assertThatThrownBy(enumeration::next).isInstanceOf(NoSuchElementException.class);
    }

    private static List<WorkItem> drain(SweepEnumeration enumeration) {
        List<WorkItem> items = new ArrayList<>();
        enumeration.forEachRemaining(items::add);
        return items;
    }
}
