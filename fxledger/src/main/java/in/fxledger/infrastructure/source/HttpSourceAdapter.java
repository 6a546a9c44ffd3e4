package in.fxledger.infrastructure.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxledger.application.port.output.SourceAdapter;
import in.fxledger.domain.common.FetchException;
import in.fxledger.domain.common.MalformedPayloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Base of the direct-API source adapters.
 *
 * Non-2xx responses and transport failures become {@link FetchException}.
 */
public abstract class HttpSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(HttpSourceAdapter.class);

    protected static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    protected static final String USER_AGENT =
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    protected final HttpClient client;
    protected final ObjectMapper mapper;
    protected final Clock clock;

    protected HttpSourceAdapter(HttpClient client, ObjectMapper mapper, Clock clock) {
        this.client = client;
        this.mapper = mapper;
        this.clock = clock;
    }

    public static HttpClient defaultClient() {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    protected HttpRequest.Builder request(URI uri, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(REQUEST_TIMEOUT)
            .header("User-Agent", USER_AGENT)
            .header("Accept-Language", "en-US,en;q=0.9");
        headers.forEach(builder::header);
        return builder;
    }

    /**
     * Send a request and return the body of a 2xx response.
     */
    protected String send(HttpRequest request) {
        String source = kind().sourceName();
        log.debug("[{}] {} {}", source, request.method(), request.uri());
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new FetchException(source, "request to " + request.uri().getHost() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(source, "request interrupted", e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new FetchException(source, "HTTP " + status + " from " + request.uri().getHost() + request.uri().getPath());
        }
        return response.body();
    }

    protected JsonNode parseJson(String body) {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException(kind().sourceName(), "response is not JSON: " + e.getOriginalMessage(), e);
        }
    }
}
