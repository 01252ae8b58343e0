/**
 * Foreman source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.foreman.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.foreman.cli.ForemanCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.foreman.dispatch.Dispatcher} runs one pass: recovery, escalation, build and validation launches.</li>
 *   <li>{@code io.foreman.storage.TaskStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.foreman;
