/**
 * Domain model for ensemble runs.
 *
 * <p>All types in this package are immutable and thread-safe.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ensemble.orchestrator.domain.model.SweepSpec} - The two-axis parameter grid</li>
 *   <li>{@link fr.lapetina.ensemble.orchestrator.domain.model.RunConfig} - Template parameters plus the two sweep keys</li>
 *   <li>{@link fr.lapetina.ensemble.orchestrator.domain.model.WorkItem} - One run: its directory and its config</li>
 *   <li>{@link fr.lapetina.ensemble.orchestrator.domain.model.TerminationToken} - Queue sentinel that stops a worker</li>
 *   <li>{@link fr.lapetina.ensemble.orchestrator.domain.model.RunOutcome} - Result of executing one work item</li>
 * </ul>
 */
package fr.lapetina.ensemble.orchestrator.domain.model;
