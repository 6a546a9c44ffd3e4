package in.fxledger.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * XE.com charting series and mid-market converter, combined into one payload:
 * {@code {method, fromCurrency, toCurrency, capturedAt, charting, midmarket}}.
 */
public final class XeHttpAdapter extends HttpSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(XeHttpAdapter.class);

    public static final URI DEFAULT_BASE_URL = URI.create("https://www.xe.com/api/protected/");

    private final URI baseUrl;
    private final String authToken;

    public XeHttpAdapter(HttpClient client, ObjectMapper mapper, Clock clock, URI baseUrl, String authToken) {
        super(client, mapper, clock);
        this.baseUrl = baseUrl;
        this.authToken = authToken;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.XE;
    }

    @Override
    public CapturedSnapshot fetch(JobOptions options) {
        String from = options.getString(JobOptions.FROM_CURRENCY, "USD").toUpperCase(Locale.ROOT);
        String to = options.getString(JobOptions.TO_CURRENCY, "VND").toUpperCase(Locale.ROOT);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "*/*");
        headers.put("Referer", "https://www.xe.com/currencyconverter/convert/?Amount=1&From=" + from + "&To=" + to);
        if (authToken != null && !authToken.isBlank()) {
            headers.put("Authorization", authToken);
        }

        URI chartingUri = baseUrl.resolve("charting-rates/?fromCurrency=" + encode(from)
            + "&toCurrency=" + encode(to) + "&crypto=true");
        JsonNode charting = parseJson(send(request(chartingUri, headers).GET().build()));
        JsonNode midmarket = parseJson(send(request(baseUrl.resolve("midmarket-converter/"), headers).GET().build()));

        Instant capturedAt = clock.instant();
        ObjectNode payload = mapper.createObjectNode();
        payload.put("method", CaptureMethod.DIRECT_API.wireName());
        payload.put("fromCurrency", from);
        payload.put("toCurrency", to);
        payload.put("capturedAt", capturedAt.toString());
        payload.set("charting", charting);
        payload.set("midmarket", midmarket);

        log.info("[{}] Fetched {}/{} chart ({} batch(es))", kind().sourceName(), from, to,
            charting.path("batchList").size());
        return new CapturedSnapshot(SnapshotIdentifiers.sanitize(from + "_" + to),
            new RawSnapshot(payload, capturedAt, CaptureMethod.DIRECT_API));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
