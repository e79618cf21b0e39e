package fr.lapetina.batchinference;

import fr.lapetina.batchinference.domain.model.BatchResult;

/**
 * Callback invoked by a worker once every request of a batch has been answered.
 *
 * Runs on the worker thread; implementations should return quickly. Exceptions
 * are logged and ignored.
 */
@FunctionalInterface
public interface BatchResultListener {

    void onBatchCompleted(BatchResult result);

    BatchResultListener NO_OP = result -> { };
}
