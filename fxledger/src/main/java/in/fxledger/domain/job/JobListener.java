package in.fxledger.domain.job;

import in.fxledger.domain.common.TerminalTaskFailureException;

/**
 * Queue event callbacks. Invoked on the queue's dispatcher thread; exceptions
 * thrown by a listener are logged and never affect the job.
 */
public interface JobListener {

    default void onCompleted(Job job, Object result) {}

    /**
     * An attempt failed.
     *
     * @param willRetry false when this was the last attempt
     */
    default void onFailed(Job job, Throwable error, boolean willRetry) {}

    default void onTerminalFailure(Job job, TerminalTaskFailureException failure) {}
}
