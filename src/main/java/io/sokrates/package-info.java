/**
 * Sokrates background task queue.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.sokrates.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.sokrates.cli.SokratesCommand} maps commands to the queue operations.</li>
 *   <li>{@code io.sokrates.daemon.QueueDaemon} claims and runs tasks one at a time.</li>
 *   <li>{@code io.sokrates.storage.TaskStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.sokrates;
