/**
 * Queue, scheduler, workers and periodic tasks behind the engine.
 *
 * <p>{@link fr.lapetina.batchinference.scheduler.RequestQueue} and
 * {@link fr.lapetina.batchinference.scheduler.ActiveBatchRegistry} each own a single lock.
 * Critical sections only move data; backend calls and replies happen outside them.
 */
package fr.lapetina.batchinference.scheduler;
