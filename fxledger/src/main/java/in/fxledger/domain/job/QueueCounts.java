package in.fxledger.domain.job;

/**
 * Jobs held by a queue, by state.
 *
 * @param waiting enqueued and not yet started
 * @param delayed waiting for a retry backoff to elapse
 * @param failed failed terminally and kept
 */
public record QueueCounts(
    String queue,
    int waiting,
    int active,
    int delayed,
    int failed,
    int repeatable
) {}
