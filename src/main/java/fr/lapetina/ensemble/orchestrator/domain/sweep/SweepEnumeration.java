package fr.lapetina.ensemble.orchestrator.domain.sweep;

import fr.lapetina.ensemble.orchestrator.domain.model.RunConfig;
import fr.lapetina.ensemble.orchestrator.domain.model.SweepSpec;
import fr.lapetina.ensemble.orchestrator.domain.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy, finite, single-use walk over a sweep grid.
 *
 * Not thread-safe: one producer drains it.
 */
public final class SweepEnumeration implements Iterator<WorkItem> {

    private static final Logger log = LoggerFactory.getLogger(SweepEnumeration.class);

    private final RunConfig template;
    private final SweepSpec spec;
    private final Path ensembleRoot;

    private int feedIndex;
    private int killIndex;
    private WorkItem next;
    private int generatedCount;
    private int skippedCount;

    SweepEnumeration(RunConfig template, SweepSpec spec, Path ensembleRoot) {
        this.template = template;
        this.spec = spec;
        this.ensembleRoot = ensembleRoot;
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = advance();
        }
        return next != null;
    }

    @Override
    public WorkItem next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Sweep exhausted");
        }
        WorkItem item = next;
        next = null;
        generatedCount++;
        return item;
    }

    /**
     * Number of work items handed out so far.
     */
    public int getGeneratedCount() {
        return generatedCount;
    }

    /**
     * Number of grid points skipped so far because their directory exists.
     */
    public int getSkippedCount() {
        return skippedCount;
    }

    private WorkItem advance() {
        SweepSpec.Axis feedAxis = spec.feedRate();
        SweepSpec.Axis killAxis = spec.killRate();

        while (feedIndex < feedAxis.count()) {
            if (killIndex >= killAxis.count()) {
                feedIndex++;
                killIndex = 0;
                continue;
            }

            double f = feedAxis.valueAt(feedIndex);
            double k = killAxis.valueAt(killIndex);
            killIndex++;

            Path directory = ensembleRoot.resolve(RunDescriptorGenerator.directoryName(f, k));
            if (Files.exists(directory)) {
                skippedCount++;
                log.info("Skipping run: runDir={}, reason=already exists", directory);
                continue;
            }

            return new WorkItem(directory, template.withSweepPoint(f, k));
        }
        return null;
    }
}
