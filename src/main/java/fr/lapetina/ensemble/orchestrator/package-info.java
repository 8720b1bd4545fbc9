/**
 * Ensemble Orchestrator - runs parameter-sweep simulation ensembles, one run per compute node.
 *
 * <p>The orchestrator enumerates a two-axis grid of simulation parameters, stages one
 * run directory per grid point and hands the runs to a pool of workers, one per node
 * allocated to the job. Each worker launches its run as a node-parallel job and waits
 * for it before taking the next one.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ensemble.orchestrator.EnsembleOrchestratorApplication} - Command-line entry point</li>
 *   <li>{@link fr.lapetina.ensemble.orchestrator.OrchestratorFactory} - Wires the components from job settings</li>
 *   <li>{@link fr.lapetina.ensemble.orchestrator.dispatch.WorkerPoolSupervisor} - Worker pool and termination protocol</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * java -jar ensemble-orchestrator.jar settings.json
 * }</pre>
 * where {@code settings.json} holds {@code gs_exe}, {@code gs_json}, {@code adios2_xml}
 * and {@code ensemble_root}.
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Resumable ensembles: grid points whose directory exists are skipped</li>
 *   <li>srun or mpirun launch depending on the scheduler</li>
 *   <li>Best-effort continuation: a failed run never stops the sweep</li>
 *   <li>Micrometer metrics with optional Prometheus text export</li>
 * </ul>
 *
 * @see fr.lapetina.ensemble.orchestrator.OrchestratorFactory
 * @see fr.lapetina.ensemble.orchestrator.dispatch.WorkerPoolSupervisor
 */
package fr.lapetina.ensemble.orchestrator;
