package in.fxledger.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxledger.domain.common.FetchException;
import in.fxledger.domain.common.MalformedPayloadException;
import in.fxledger.domain.job.JobOptions;
import in.fxledger.domain.model.CapturedSnapshot;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.util.Headers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Adapters against a local stub of the provider endpoints.
 */
class HttpSourceAdapterTest {

    private static final int TEST_PORT = 19191;
    private static final String BASE = "http://localhost:" + TEST_PORT;
    private static final Instant NOW = Instant.parse("2026-01-29T03:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final Map<String, String> seen = new ConcurrentHashMap<>();
    private HttpClient client;
    private Undertow server;

    @BeforeEach
    void setUp() {
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path()
                .addExactPath("/vcb", exchange -> {
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/xml");
                    exchange.getResponseSender().send(
                        "<ExrateList><DateTime>1/29/2026 9:25:44 AM</DateTime>"
                            + "<Exrate CurrencyCode=\"USD\" Buy=\"25,350.00\" Transfer=\"25,380.00\" Sell=\"25,410.00\"/>"
                            + "</ExrateList>");
                })
                .addExactPath("/broken", exchange -> exchange.getResponseSender().send("<html>maintenance"))
                .addPrefixPath("/chart", exchange -> {
                    seen.put("interval", exchange.getQueryParameters().get("interval").getFirst());
                    exchange.getResponseSender().send(
                        "{\"chart\":{\"result\":[{\"meta\":{\"symbol\":\"VND=X\"},\"timestamp\":[1769644800]}]}}");
                })
                .addPrefixPath("/xe/charting-rates", exchange -> {
                    seen.put("from", exchange.getQueryParameters().get("fromCurrency").getFirst());
                    String auth = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
                    seen.put("auth", auth == null ? "" : auth);
                    exchange.getResponseSender().send(
                        "{\"batchList\":[{\"startTime\":1769644800000,\"interval\":900000,\"rates\":[26100.5]}]}");
                })
                .addPrefixPath("/xe/midmarket-converter", exchange -> exchange.getResponseSender().send(
                    "{\"rates\":{\"VND\":{\"rate\":26123.4}}}"))
                .addExactPath("/reuters", exchange -> exchange.getRequestReceiver().receiveFullString((ex, body) -> {
                    seen.put("body", body);
                    ex.getResponseSender().send("{\"data\":{\"elements\":[]}}");
                }))
                .addExactPath("/down", exchange -> {
                    exchange.setStatusCode(503);
                    exchange.getResponseSender().send("unavailable");
                }))
            .build();
        server.start();
        client = HttpSourceAdapter.defaultClient();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void vcbSheetIsConvertedFromXml() {
        VcbHttpAdapter adapter = new VcbHttpAdapter(client, mapper, clock, URI.create(BASE + "/vcb"));

        CapturedSnapshot captured = adapter.fetch(JobOptions.empty());

        assertEquals("rates", captured.identifier());
        assertEquals(NOW, captured.snapshot().capturedAt());
        JsonNode row = captured.snapshot().payload().path("ExrateList").path("Exrate");
        assertEquals("USD", row.path("@_CurrencyCode").asText());
        assertEquals("xml", captured.original().extension());
        assertTrue(captured.original().content().startsWith("<ExrateList>"));
    }

    @Test
    void vcbNonXmlIsMalformed() {
        VcbHttpAdapter adapter = new VcbHttpAdapter(client, mapper, clock, URI.create(BASE + "/broken"));

        assertThrows(MalformedPayloadException.class, () -> adapter.fetch(JobOptions.empty()));
    }

    @Test
    void yahooChartIsStoredUnderSanitizedSymbol() {
        YahooHttpAdapter adapter = new YahooHttpAdapter(client, mapper, clock, URI.create(BASE + "/chart/"));

        CapturedSnapshot captured = adapter.fetch(JobOptions.empty()
            .with(JobOptions.SYMBOL, "VND=X")
            .with(JobOptions.INTERVAL, "1h"));

        assertEquals("VND_X", captured.identifier());
        assertEquals("1h", seen.get("interval"));
        assertEquals("VND=X", captured.snapshot().payload().at("/chart/result/0/meta/symbol").asText());
    }

    @Test
    void xeCombinesChartAndMidmarket() {
        XeHttpAdapter adapter = new XeHttpAdapter(client, mapper, clock, URI.create(BASE + "/xe/"), "Basic abc");

        CapturedSnapshot captured = adapter.fetch(JobOptions.empty()
            .with(JobOptions.FROM_CURRENCY, "eur")
            .with(JobOptions.TO_CURRENCY, "vnd"));

        JsonNode payload = captured.snapshot().payload();
        assertEquals("EUR_VND", captured.identifier());
        assertEquals("EUR", seen.get("from"));
        assertEquals("Basic abc", seen.get("auth"));
        assertEquals("direct-api", payload.get("method").asText());
        assertEquals(NOW.toString(), payload.get("capturedAt").asText());
        assertEquals(1, payload.at("/charting/batchList").size());
        assertEquals(26123.4, payload.at("/midmarket/rates/VND/rate").asDouble());
    }

    @Test
    void xeWithoutTokenSendsNoAuthorization() {
        XeHttpAdapter adapter = new XeHttpAdapter(client, mapper, clock, URI.create(BASE + "/xe/"), "");

        adapter.fetch(JobOptions.empty());

        assertEquals("", seen.get("auth"));
        assertEquals("USD", seen.get("from"));
    }

    @Test
    void reutersPostsAppRequest() throws Exception {
        ReutersHttpAdapter adapter = new ReutersHttpAdapter(client, mapper, clock,
            URI.create(BASE + "/reuters"), "", Map.of("VND=", "611986"));

        CapturedSnapshot captured = adapter.fetch(JobOptions.empty().with(JobOptions.SYMBOL, "VND="));

        JsonNode body = mapper.readTree(seen.get("body"));
        assertEquals("marketAppId", body.get(0).get("key").asText());
        assertEquals(611986L, body.get(1).get("value").asLong());
        assertTrue(body.get(1).get("value").isNumber());
        assertEquals("VND_", captured.identifier());
        assertEquals("VND=", captured.snapshot().payload().get("symbol").asText());
        assertNull(captured.original());
        assertTrue(captured.snapshot().payload().at("/data/data/elements").isArray());
    }

    @Test
    void reutersXidFollowsTheSymbol() throws Exception {
        ReutersHttpAdapter adapter = new ReutersHttpAdapter(client, mapper, clock,
            URI.create(BASE + "/reuters"), "", Map.of("VND=X", "611986", "EUR=X", "611987"));

        CapturedSnapshot eur = adapter.fetch(JobOptions.empty().with(JobOptions.SYMBOL, "EUR=X"));

        assertEquals(611987L, mapper.readTree(seen.get("body")).get(1).get("value").asLong());
        assertEquals("611987", eur.snapshot().payload().get("xid").asText());
        assertEquals("EUR_X", eur.identifier());

        adapter.fetch(JobOptions.empty().with(JobOptions.SYMBOL, "EUR=X").with(JobOptions.XID, "42"));
        assertEquals(42L, mapper.readTree(seen.get("body")).get(1).get("value").asLong());
    }

    @Test
    void reutersSymbolWithoutXidIsRejected() {
        ReutersHttpAdapter adapter = new ReutersHttpAdapter(client, mapper, clock,
            URI.create(BASE + "/reuters"), "", Map.of("VND=X", "611986"));

        assertThrows(IllegalArgumentException.class,
            () -> adapter.fetch(JobOptions.empty().with(JobOptions.SYMBOL, "JPY=X")));
        assertNull(seen.get("body"));
    }

    @Test
    void non2xxIsFetchFailure() {
        YahooHttpAdapter adapter = new YahooHttpAdapter(client, mapper, clock, URI.create(BASE + "/down"));
        VcbHttpAdapter vcb = new VcbHttpAdapter(client, mapper, clock, URI.create(BASE + "/down"));

        FetchException e = assertThrows(FetchException.class, () -> vcb.fetch(JobOptions.empty()));
        assertTrue(e.getMessage().contains("503"));
        assertThrows(FetchException.class, () -> adapter.fetch(JobOptions.empty()));
    }

    @Test
    void unreachableHostIsFetchFailure() {
        VcbHttpAdapter adapter = new VcbHttpAdapter(client, mapper, clock, URI.create("http://localhost:1/vcb"));

        assertThrows(FetchException.class, () -> adapter.fetch(JobOptions.empty()));
    }
}
