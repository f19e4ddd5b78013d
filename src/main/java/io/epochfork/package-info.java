/**
 * Epoch-fork conformance oracle source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.epochfork.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.epochfork.cli.EpochForkCommand} maps commands to the runner.</li>
 *   <li>{@code io.epochfork.runtime.EpochForkRunner} selects, evaluates and persists scenario results.</li>
 *   <li>{@code io.epochfork.engine.EpochForkSimulator} is the per-scenario deterministic fold.</li>
 * </ul>
 */
package io.epochfork;
