/**
 * Corpus-level orchestration.
 *
 * <p>{@link io.epochfork.runtime.EpochForkRunner} selects scenarios, isolates corpus faults
 * per scenario, evaluates them (optionally on a worker pool) and persists the envelope
 * stream and run summary used by the CLI.
 */
package io.epochfork.runtime;
