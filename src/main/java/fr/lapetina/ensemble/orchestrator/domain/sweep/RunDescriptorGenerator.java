package fr.lapetina.ensemble.orchestrator.domain.sweep;

import fr.lapetina.ensemble.orchestrator.domain.model.RunConfig;
import fr.lapetina.ensemble.orchestrator.domain.model.SweepSpec;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Enumerates the sweep grid into work items.
 *
 * Grid points whose run directory already exists are skipped, so rerunning the
 * orchestrator against the same ensemble root resumes an interrupted ensemble
 * at the granularity of whole runs.
 *
 * Two enumerations over the same ensemble root running at the same time may both
 * yield the same point; the executor reports the loser as a directory conflict.
 */
public class RunDescriptorGenerator {

    /**
     * Starts a lazy enumeration of the grid, F on the outer loop and k on the inner.
     * Nothing is written to disk; each point only costs one existence check.
     *
     * @param template     template config; its sweep keys are overwritten per point
     * @param spec         the grid
     * @param ensembleRoot directory under which run directories live
     * @return a single-use iterator over the work items to run
     */
    public SweepEnumeration generate(RunConfig template, SweepSpec spec, Path ensembleRoot) {
        Objects.requireNonNull(template, "Template is required");
        Objects.requireNonNull(spec, "Sweep spec is required");
        Objects.requireNonNull(ensembleRoot, "Ensemble root is required");
        return new SweepEnumeration(template, spec, ensembleRoot);
    }

    /**
     * Directory name for one grid point, e.g. {@code F_0.01-k_0.05}.
     */
    public static String directoryName(double feedRate, double killRate) {
        return "F_" + SweepSpec.format(feedRate) + "-k_" + SweepSpec.format(killRate);
    }
}
