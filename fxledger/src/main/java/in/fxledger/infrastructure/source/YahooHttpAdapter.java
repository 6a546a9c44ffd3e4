package in.fxledger.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Yahoo Finance v8 chart API. Fetches the last 7 days of bars for one symbol;
 * the response is stored as returned.
 */
public final class YahooHttpAdapter extends HttpSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(YahooHttpAdapter.class);

    public static final URI DEFAULT_BASE_URL = URI.create("https://query2.finance.yahoo.com/v8/finance/chart/");
    static final Duration WINDOW = Duration.ofDays(7);
    static final String DEFAULT_INTERVAL = "1d";

    private final URI baseUrl;

    public YahooHttpAdapter(HttpClient client, ObjectMapper mapper, Clock clock, URI baseUrl) {
        super(client, mapper, clock);
        this.baseUrl = baseUrl;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.YAHOO;
    }

    @Override
    public CapturedSnapshot fetch(JobOptions options) {
        String symbol = options.getString(JobOptions.SYMBOL, "VND=X");
        String interval = options.getString(JobOptions.INTERVAL, DEFAULT_INTERVAL);
        Instant now = clock.instant();

        URI uri = baseUrl.resolve(encode(symbol)
            + "?period1=" + now.minus(WINDOW).getEpochSecond()
            + "&period2=" + now.getEpochSecond()
            + "&interval=" + encode(interval)
            + "&includePrePost=true");
        JsonNode payload = parseJson(send(request(uri, Map.of(
            "Accept", "*/*",
            "Referer", "https://finance.yahoo.com/quote/" + encode(symbol) + "/")).GET().build()));

        log.info("[{}] Fetched {} chart ({} bar(s))", kind().sourceName(), symbol,
            payload.path("chart").path("result").path(0).path("timestamp").size());
        return new CapturedSnapshot(SnapshotIdentifiers.sanitize(symbol),
            new RawSnapshot(payload, now, CaptureMethod.DIRECT_API));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
