package fr.lapetina.ensemble.orchestrator.infrastructure.environment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlurmEnvironmentTest {

    @Test
    @DisplayName("should report no scheduler and one node on a plain machine")
    void shouldDefaultWithoutSlurm() {
        SlurmEnvironment environment = new SlurmEnvironment(Map.of("HOME", "/home/user", "PATH", "/usr/bin"));

        assertThat(environment.hasClusterScheduler()).isFalse();
        assertThat(environment.nodeCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should read the node count of the job")
    void shouldReadNodeCount() {
        SlurmEnvironment environment = new SlurmEnvironment(Map.of(
                "SLURM_JOB_ID", "42",
                "SLURM_JOB_NUM_NODES", "3"));

        assertThat(environment.hasClusterScheduler()).isTrue();
        assertThat(environment.nodeCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("should treat any SLURM-prefixed variable as scheduler presence")
    void shouldDetectAnySlurmVariable() {
        assertThat(new SlurmEnvironment(Map.of("SLURMD_NODENAME", "nid001")).hasClusterScheduler()).isTrue();
        assertThat(new SlurmEnvironment(Map.of("MY_SLURM_HINT", "x")).hasClusterScheduler()).isFalse();
    }

    @Test
    @DisplayName("should reject a node count that is not a positive number")
    void shouldRejectInvalidNodeCount() {
        assertThatThrownBy(() -> new SlurmEnvironment(Map.of("SLURM_JOB_NUM_NODES", "two")).nodeCount())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SLURM_JOB_NUM_NODES");
        assertThatThrownBy(() -> new SlurmEnvironment(Map.of("SLURM_JOB_NUM_NODES", "0")).nodeCount())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should see at least one processor")
    void shouldSeeProcessors() {
        assertThat(new SlurmEnvironment(Map.of()).availableProcessors()).isPositive();
    }
}
