package in.fxledger.infrastructure.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.fxledger.domain.job.JobOptions;
import in.fxledger.domain.model.CaptureMethod;
import in.fxledger.domain.model.CapturedSnapshot;
import in.fxledger.domain.model.RawSnapshot;
import in.fxledger.domain.model.SnapshotIdentifiers;
import in.fxledger.domain.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reuters currency quote via the markitdigital universal app API.
 *
 * The instrument is addressed by its {@code xid}: the job's {@code xid} option,
 * else the xid configured for the job's symbol. Stored payload:
 * {@code {method, xid, symbol, capturedAt, data}}.
 */
public final class ReutersHttpAdapter extends HttpSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(ReutersHttpAdapter.class);

    public static final URI DEFAULT_URL =
        URI.create("https://api.markitdigital.com/fwc-api-service/v1/fwc-universal-app");
    static final String MARKET_APP_ID = "fwc-currency-detailed-quote";

    private final URI url;
    private final String authToken;
    private final Map<String, String> xidsBySymbol;

    public ReutersHttpAdapter(HttpClient client, ObjectMapper mapper, Clock clock,
                              URI url, String authToken, Map<String, String> xidsBySymbol) {
        super(client, mapper, clock);
        this.url = url;
        this.authToken = authToken;
        this.xidsBySymbol = Map.copyOf(xidsBySymbol);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.REUTERS;
    }

    @Override
    public CapturedSnapshot fetch(JobOptions options) {
        String symbol = options.getString(JobOptions.SYMBOL, "VND=X");
        String xid = options.getString(JobOptions.XID)
            .or(() -> Optional.ofNullable(xidsBySymbol.get(symbol)))
            .filter(value -> !value.isBlank())
            .orElseThrow(() -> new IllegalArgumentException("No xid configured for Reuters symbol " + symbol));

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "*/*");
        headers.put("Content-Type", "application/json");
        headers.put("Referer", "https://www.reuters.com/");
        if (authToken != null && !authToken.isBlank()) {
            headers.put("Authorization", authToken);
        }
        HttpRequest request = request(url, headers)
            .POST(HttpRequest.BodyPublishers.ofString(requestBody(xid)))
            .build();
        JsonNode data = parseJson(send(request));

        Instant capturedAt = clock.instant();
        ObjectNode payload = mapper.createObjectNode();
        payload.put("method", CaptureMethod.DIRECT_API.wireName());
        payload.put("xid", xid);
        payload.put("symbol", symbol);
        payload.put("capturedAt", capturedAt.toString());
        payload.set("data", data);

        log.info("[{}] Fetched quote for {} (xid {})", kind().sourceName(), symbol, xid);
        return new CapturedSnapshot(SnapshotIdentifiers.sanitize(symbol),
            new RawSnapshot(payload, capturedAt, CaptureMethod.DIRECT_API));
    }

    private String requestBody(String xid) {
        ArrayNode body = mapper.createArrayNode();
        body.addObject().put("key", "marketAppId").put("value", MARKET_APP_ID);
        ObjectNode xidEntry = body.addObject().put("key", "xid");
        if (!xid.isEmpty() && xid.chars().allMatch(Character::isDigit)) {
            xidEntry.put("value", Long.parseLong(xid));
        } else {
            xidEntry.put("value", xid);
        }
        body.addObject().put("key", "showLinks").put("value", false);
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode request body", e);
        }
    }
}
