/**
 * Deterministic epoch-fork simulation core.
 *
 * <p>{@link io.epochfork.engine.EpochForkSimulator} folds one scenario's scheduled events
 * through {@link io.epochfork.engine.ForkDetector} and
 * {@link io.epochfork.engine.ChainIntegrityChecker}, then asks
 * {@link io.epochfork.engine.ReconciliationResolver} for the canonical record and
 * {@link io.epochfork.engine.ExpectationEvaluator} for the verdict. All state lives in a
 * {@link io.epochfork.engine.SimulationContext} created per scenario.
 */
package io.epochfork.engine;
