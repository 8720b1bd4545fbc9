/**
 * Work distribution across the worker pool.
 *
 * <p>The supervisor starts one {@link fr.lapetina.ensemble.orchestrator.dispatch.EnsembleWorker}
 * per allocated node. Workers share nothing but the
 * {@link fr.lapetina.ensemble.orchestrator.dispatch.WorkQueue} and the append-only
 * {@link fr.lapetina.ensemble.orchestrator.dispatch.OutcomeLedger}.
 *
 * <h2>Termination Protocol</h2>
 * <p>Once every work item is enqueued, the supervisor enqueues one
 * {@link fr.lapetina.ensemble.orchestrator.domain.model.TerminationToken} per worker.
 * A worker exits on the first token it takes, so every worker exits exactly once and
 * only after the real work ahead of the tokens has been claimed.
 */
package fr.lapetina.ensemble.orchestrator.dispatch;
