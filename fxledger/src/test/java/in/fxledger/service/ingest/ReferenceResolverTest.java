package in.fxledger.service.ingest;

import in.fxledger.application.port.output.IngestionSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReferenceResolverTest {

    @Mock
    private IngestionSession session;

    @Test
    void sourceIdIsCachedPerRun() {
        when(session.getOrCreateSource("VietcomBank")).thenReturn(3);
        ReferenceResolver resolver = new ReferenceResolver(session);

        assertEquals(3, resolver.resolveSource("VietcomBank"));
        assertEquals(3, resolver.resolveSource("VietcomBank"));
        verify(session, times(1)).getOrCreateSource("VietcomBank");
    }

    @Test
    void pairIsNormalizedAndCached() {
        when(session.getOrCreatePair("USDVND", "USD", "VND")).thenReturn(7);
        ReferenceResolver resolver = new ReferenceResolver(session);

        assertEquals(7, resolver.resolvePair("usd", "vnd"));
        assertEquals(7, resolver.resolvePair("USD", "VND"));
        assertEquals(1, resolver.pairCount());
        verify(session, times(1)).getOrCreatePair("USDVND", "USD", "VND");
    }

    @Test
    void blankSourceRejected() {
        ReferenceResolver resolver = new ReferenceResolver(session);

        assertThrows(IllegalArgumentException.class, () -> resolver.resolveSource(" "));
        verifyNoInteractions(session);
    }

    @Test
    void invalidCurrencyRejected() {
        ReferenceResolver resolver = new ReferenceResolver(session);

        assertThrows(IllegalArgumentException.class, () -> resolver.resolvePair("US", "VND"));
    }
}
