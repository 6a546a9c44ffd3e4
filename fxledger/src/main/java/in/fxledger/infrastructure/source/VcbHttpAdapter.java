package in.fxledger.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxledger.domain.common.MalformedPayloadException;
import in.fxledger.domain.job.JobOptions;
import in.fxledger.domain.model.CaptureMethod;
import in.fxledger.domain.model.CapturedSnapshot;
import in.fxledger.domain.model.RawSnapshot;
import in.fxledger.domain.model.SnapshotIdentifiers;
import in.fxledger.domain.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.util.Map;

/**
 * VietcomBank XML rate sheet, converted to JSON on capture. The XML is handed
 * back as the original so it can be stored next to the JSON.
 */
public final class VcbHttpAdapter extends HttpSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(VcbHttpAdapter.class);

    public static final URI DEFAULT_URL =
        URI.create("https://portal.vietcombank.com.vn/Usercontrols/TVPortal.TyGia/pXML.aspx");

    private final URI url;
    private final VcbXmlConverter converter = new VcbXmlConverter();

    public VcbHttpAdapter(HttpClient client, ObjectMapper mapper, Clock clock, URI url) {
        super(client, mapper, clock);
        this.url = url;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.VCB;
    }

    @Override
    public CapturedSnapshot fetch(JobOptions options) {
        HttpRequest request = request(url, Map.of("Accept", "application/xml, text/xml, */*")).GET().build();
        String xml = send(request);

        JsonNode payload;
        try {
            payload = converter.convert(xml);
        } catch (IOException e) {
            throw new MalformedPayloadException(kind().sourceName(), "rate sheet is not valid XML", e);
        }
        int rows = payload.path("ExrateList").path("Exrate").size();
        log.info("[{}] Fetched rate sheet ({} rows)", kind().sourceName(), rows);
        return new CapturedSnapshot(SnapshotIdentifiers.VCB_SHEET,
            new RawSnapshot(payload, clock.instant(), CaptureMethod.DIRECT_API),
            new CapturedSnapshot.Original("xml", xml));
    }
}
