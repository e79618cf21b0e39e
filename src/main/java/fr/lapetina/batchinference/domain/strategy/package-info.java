/**
 * Batch sizing and client selection strategies.
 *
 * <p>Strategies are looked up by name through
 * {@link fr.lapetina.batchinference.domain.strategy.StrategyFactory}:
 * {@code dynamic} and {@code fixed} for sizing, {@code worker-affinity} and
 * {@code round-robin} for client selection.
 */
package fr.lapetina.batchinference.domain.strategy;
