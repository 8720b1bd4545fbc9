/**
 * Launch command construction.
 *
 * <p>Each run occupies one full node, so every launcher requests as many ranks as the
 * worker sees processors.
 *
 * <h2>Available Launchers</h2>
 * <ul>
 *   <li>{@code auto} - srun under Slurm, mpirun elsewhere (default)</li>
 *   <li>{@code srun} - {@code srun -n <ranks> -N 1}</li>
 *   <li>{@code mpirun} - {@code mpirun -np <ranks>}</li>
 *   <li>{@code direct} - the executable alone, no parallel launcher</li>
 * </ul>
 *
 * @see fr.lapetina.ensemble.orchestrator.domain.launch.LaunchCommandBuilder
 * @see fr.lapetina.ensemble.orchestrator.domain.launch.LaunchStrategyFactory
 */
package fr.lapetina.ensemble.orchestrator.domain.launch;
