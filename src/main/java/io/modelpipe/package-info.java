/**
 * ModelPipe source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.modelpipe.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.modelpipe.pipeline.PipelineStore} is the job queue and project event log port.</li>
 *   <li>{@code io.modelpipe.pipeline.JobQueue} owns submission, claiming, retries and dead-lettering.</li>
 *   <li>{@code io.modelpipe.storage.DurablePipelineStore} persists the whole state as one SQLite document.</li>
 * </ul>
 */
package io.modelpipe;
