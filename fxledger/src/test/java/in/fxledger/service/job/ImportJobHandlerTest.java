package in.fxledger.service.job;

import in.fxledger.domain.job.Job;
import in.fxledger.domain.job.JobOptions;
import in.fxledger.domain.model.ImportMode;
import in.fxledger.domain.model.SourceKind;
import in.fxledger.service.ingest.SnapshotImporter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImportJobHandlerTest {

    @Mock
    private SnapshotImporter importer;

    private static Job job(SourceKind kind, JobOptions options) {
        return new Job("manual-1", kind.importQueue(), options, Instant.now());
    }

    @Test
    void defaultsToLatestForEveryIdentifier() throws Exception {
        new ImportJobHandler(SourceKind.VCB, importer).handle(job(SourceKind.VCB, JobOptions.empty()));

        verify(importer).importSnapshots(eq(SourceKind.VCB), eq(ImportMode.LATEST), isNull());
    }

    @Test
    void allModeFromOptions() throws Exception {
        new ImportJobHandler(SourceKind.YAHOO, importer)
            .handle(job(SourceKind.YAHOO, JobOptions.of(Map.of("mode", "all"))));

        verify(importer).importSnapshots(eq(SourceKind.YAHOO), eq(ImportMode.ALL), isNull());
    }

    @Test
    void unknownModeRejected() {
        ImportJobHandler handler = new ImportJobHandler(SourceKind.YAHOO, importer);

        assertThrows(IllegalArgumentException.class,
            () -> handler.handle(job(SourceKind.YAHOO, JobOptions.of(Map.of("mode", "everything")))));
        verifyNoInteractions(importer);
    }

    @Test
    void identifierDerivedFromOptions() {
        ImportJobHandler xe = new ImportJobHandler(SourceKind.XE, importer);
        ImportJobHandler yahoo = new ImportJobHandler(SourceKind.YAHOO, importer);

        assertEquals("USD_VND", xe.identifier(JobOptions.of(Map.of("identifier", "USD_VND"))));
        assertEquals("EUR_VND", xe.identifier(JobOptions.of(Map.of("fromCurrency", "EUR", "toCurrency", "VND"))));
        assertEquals("VND_X", yahoo.identifier(JobOptions.of(Map.of("symbol", "VND=X"))));
        assertNull(yahoo.identifier(JobOptions.empty()));
        assertNull(xe.identifier(JobOptions.of(Map.of("fromCurrency", "EUR"))));
    }
}
