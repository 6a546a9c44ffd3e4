package in.fxledger.domain.job;

/**
 * Work executed for each attempt of a job. Throwing fails the attempt.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * @return a result passed to completion listeners (may be null)
     */
    Object handle(Job job) throws Exception;
}
