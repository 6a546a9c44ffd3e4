package in.fxledger.domain.job;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a job, as exposed by the admin API.
 */
public record JobSnapshot(
    String id,
    String queue,
    JobStatus status,
    int attemptsMade,
    Map<String, Object> data,
    Instant createdAt,
    Instant nextRunAt,
    String lastError
) {}
