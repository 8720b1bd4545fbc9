/**
 * Startup configuration loading and validation.
 *
 * <h2>Configuration Keys</h2>
 * <ul>
 *   <li>{@code gs_exe} - simulation executable (path, or command name on PATH)</li>
 *   <li>{@code gs_json} - JSON parameter template</li>
 *   <li>{@code adios2_xml} - auxiliary descriptor copied into every run directory</li>
 *   <li>{@code ensemble_root} - existing directory that receives the run directories</li>
 *   <li>{@code sweep} - optional grid, {@code {"F": {base, step, count}, "k": {...}}}</li>
 *   <li>{@code launcher} - optional, {@code auto} (default), {@code srun}, {@code mpirun} or {@code direct}</li>
 *   <li>{@code metrics_file} - optional Prometheus text output written at the end</li>
 * </ul>
 *
 * <p>The artifact is JSON; files ending in {@code .yaml} or {@code .yml} are read as YAML.
 *
 * @see fr.lapetina.ensemble.orchestrator.infrastructure.config.JobSettingsLoader
 */
package fr.lapetina.ensemble.orchestrator.infrastructure.config;
