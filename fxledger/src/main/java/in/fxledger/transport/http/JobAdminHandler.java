package in.fxledger.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.fxledger.domain.job.JobOptions;
import in.fxledger.domain.job.QueueCounts;
import in.fxledger.service.job.CronSchedule;
import in.fxledger.service.job.IntervalSchedule;
import in.fxledger.service.job.JobQueue;
import in.fxledger.service.job.QueueRegistry;
import in.fxledger.service.job.RepeatSchedule;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * HTTP handler for queue administration.
 *
 * - GET    /api/queues                         - Counts of every queue
 * - GET    /api/queues/{queue}                 - Counts, repeatables and jobs of one queue
 * - POST   /api/queues/{queue}/jobs            - Add a one-off or repeating job
 * - DELETE /api/queues/{queue}                 - Drop all jobs and repeatables
 * - DELETE /api/queues/{queue}/jobs/{jobId}    - Remove one repeatable, else one job
 *
 * POST body:
 * <pre>
 * { "data": { "autoImport": true }, "jobId": "vcb-manual", "repeatEveryMs": 60000 }
 * { "data": {}, "jobId": "vcb-6h", "repeat": { "pattern": "0 0,6,12,18 * * *" } }
 * </pre>
 */
public final class JobAdminHandler {
    private static final Logger log = LoggerFactory.getLogger(JobAdminHandler.class);

    private final QueueRegistry queues;
    private final ObjectMapper mapper;

    public JobAdminHandler(QueueRegistry queues, ObjectMapper mapper) {
        this.queues = queues;
        this.mapper = mapper;
    }

    /**
     * GET /api/queues
     */
    public void listQueues(HttpServerExchange exchange) {
        List<QueueCounts> counts = new ArrayList<>();
        for (JobQueue queue : queues.all()) {
            counts.add(queue.counts());
        }
        sendJson(exchange, StatusCodes.OK, counts);
    }

    /**
     * GET /api/queues/{queue}
     */
    public void getQueue(HttpServerExchange exchange) {
        Optional<JobQueue> queue = findQueue(exchange);
        if (queue.isEmpty()) return;

        ObjectNode response = mapper.createObjectNode();
        response.set("counts", mapper.valueToTree(queue.get().counts()));
        response.set("repeatables", mapper.valueToTree(queue.get().repeatableNames()));
        response.set("schedules", mapper.valueToTree(queue.get().repeatableSchedules()));
        response.set("jobs", mapper.valueToTree(queue.get().jobs()));
        sendJson(exchange, StatusCodes.OK, response);
    }

    /**
     * POST /api/queues/{queue}/jobs
     */
    public void addJob(HttpServerExchange exchange) {
        Optional<JobQueue> found = findQueue(exchange);
        if (found.isEmpty()) return;
        JobQueue queue = found.get();

        exchange.getRequestReceiver().receiveFullString((exch, body) -> {
            JsonNode request;
            try {
                request = body == null || body.isBlank() ? mapper.createObjectNode() : mapper.readTree(body);
            } catch (JsonProcessingException e) {
                sendError(exch, StatusCodes.BAD_REQUEST, "Invalid JSON: " + e.getOriginalMessage());
                return;
            }
            if (!request.isObject()) {
                sendError(exch, StatusCodes.BAD_REQUEST, "Request body must be a JSON object");
                return;
            }
            JsonNode data = request.path("data");
            if (!data.isMissingNode() && !data.isNull() && !data.isObject()) {
                sendError(exch, StatusCodes.BAD_REQUEST, "data must be a JSON object");
                return;
            }

            try {
                @SuppressWarnings("unchecked")
                Map<String, Object> values = data.isObject() ? mapper.convertValue(data, Map.class) : Map.of();
                JobOptions options = JobOptions.of(values);
                String jobId = request.path("jobId").asText("");

                ObjectNode response = mapper.createObjectNode();
                response.put("queue", queue.name());
                Optional<RepeatSchedule> schedule = repeatSchedule(request);
                if (schedule.isPresent()) {
                    String repeatName = jobId.isBlank() ? defaultRepeatName(schedule.get()) : jobId;
                    queue.addRepeatable(repeatName, options, schedule.get());
                    response.put("repeatName", repeatName);
                    response.put("repeat", schedule.get().describe());
                    log.info("POST /api/queues/{}/jobs → 201 repeatable {} ({})", queue.name(), repeatName,
                        schedule.get().describe());
                    sendJson(exch, StatusCodes.CREATED, response);
                    return;
                }

                String id = jobId.isBlank() ? "manual-" + UUID.randomUUID() : jobId;
                boolean added = queue.add(id, options);
                response.put("jobId", id);
                response.put("added", added);
                log.info("POST /api/queues/{}/jobs → {} job {} (added={})", queue.name(),
                    added ? StatusCodes.CREATED : StatusCodes.OK, id, added);
                sendJson(exch, added ? StatusCodes.CREATED : StatusCodes.OK, response);

            } catch (IllegalArgumentException e) {
                sendError(exch, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (IllegalStateException e) {
                sendError(exch, StatusCodes.SERVICE_UNAVAILABLE, e.getMessage());
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * DELETE /api/queues/{queue}
     */
    public void clearQueue(HttpServerExchange exchange) {
        Optional<JobQueue> queue = findQueue(exchange);
        if (queue.isEmpty()) return;

        int cleared = queue.get().clear();
        ObjectNode response = mapper.createObjectNode();
        response.put("queue", queue.get().name());
        response.put("cleared", cleared);
        log.info("DELETE /api/queues/{} → 200 ({} job(s) cleared)", queue.get().name(), cleared);
        sendJson(exchange, StatusCodes.OK, response);
    }

    /**
     * DELETE /api/queues/{queue}/jobs/{jobId}
     */
    public void removeJob(HttpServerExchange exchange) {
        Optional<JobQueue> queue = findQueue(exchange);
        if (queue.isEmpty()) return;
        String jobId = pathParam(exchange, "jobId");

        boolean repeatable = queue.get().removeRepeatable(jobId);
        if (!repeatable) {
            try {
                if (!queue.get().remove(jobId)) {
                    sendError(exchange, StatusCodes.NOT_FOUND, "Job not found: " + jobId);
                    return;
                }
            } catch (IllegalStateException e) {
                sendError(exchange, StatusCodes.CONFLICT, e.getMessage());
                return;
            }
        }
        ObjectNode response = mapper.createObjectNode();
        response.put("queue", queue.get().name());
        response.put("jobId", jobId);
        response.put("removed", true);
        response.put("repeatable", repeatable);
        log.info("DELETE /api/queues/{}/jobs/{} → 200 ({})", queue.get().name(), jobId, repeatable ? "repeatable" : "job");
        sendJson(exchange, StatusCodes.OK, response);
    }

    /**
     * Repeat schedule of a POST body: {@code repeatEveryMs}, or a {@code repeat}
     * object holding either {@code every} (ms) or a cron {@code pattern}.
     *
     * @throws IllegalArgumentException if the repeat is invalid
     */
    static Optional<RepeatSchedule> repeatSchedule(JsonNode request) {
        JsonNode repeat = request.path("repeat");
        if (request.has("repeatEveryMs")) {
            return Optional.of(RepeatSchedule.every(positiveMillis(request.path("repeatEveryMs"), "repeatEveryMs")));
        }
        if (repeat.isMissingNode() || repeat.isNull()) {
            return Optional.empty();
        }
        if (!repeat.isObject()) {
            throw new IllegalArgumentException("repeat must be a JSON object");
        }
        if (repeat.has("every") == repeat.has("pattern")) {
            throw new IllegalArgumentException("repeat needs exactly one of every or pattern");
        }
        if (repeat.has("every")) {
            return Optional.of(RepeatSchedule.every(positiveMillis(repeat.path("every"), "repeat.every")));
        }
        if (!repeat.path("pattern").isTextual()) {
            throw new IllegalArgumentException("repeat.pattern must be a string");
        }
        return Optional.of(RepeatSchedule.cron(repeat.path("pattern").asText()));
    }

    private static Duration positiveMillis(JsonNode value, String field) {
        long millis = value.canConvertToLong() ? value.asLong() : 0;
        if (millis <= 0) {
            throw new IllegalArgumentException(field + " must be a positive number");
        }
        return Duration.ofMillis(millis);
    }

    private static String defaultRepeatName(RepeatSchedule schedule) {
        if (schedule instanceof IntervalSchedule) {
            return "manual-" + ((IntervalSchedule) schedule).everyMillis();
        }
        return "manual-" + ((CronSchedule) schedule).pattern().replaceAll("[^0-9A-Za-z]+", "_");
    }

    private Optional<JobQueue> findQueue(HttpServerExchange exchange) {
        String name = pathParam(exchange, "queue");
        Optional<JobQueue> queue = queues.find(name);
        if (queue.isEmpty()) {
            sendError(exchange, StatusCodes.NOT_FOUND, "Unknown queue: " + name);
        }
        return queue;
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match == null ? null : match.getParameters().get(name);
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, Object data) {
        String json;
        try {
            json = data instanceof JsonNode ? data.toString() : mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize response: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to serialize response");
            return;
        }
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
