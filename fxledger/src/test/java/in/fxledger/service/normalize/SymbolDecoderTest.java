package in.fxledger.service.normalize;

import in.fxledger.domain.common.MalformedPayloadException;
import in.fxledger.domain.model.CurrencyPair;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SymbolDecoderTest {

    @Test
    void threeLetterCodeIsQuotedAgainstUsd() {
        CurrencyPair pair = SymbolDecoder.decode("Yahoo Finance", "VND=X");

        assertEquals("USD", pair.baseCurrency());
        assertEquals("VND", pair.quoteCurrency());
        assertEquals("USDVND", pair.symbol());
    }

    @Test
    void sixLetterCodeIsSplit() {
        CurrencyPair pair = SymbolDecoder.decode("Yahoo Finance", "eurjpy=x");

        assertEquals("EUR", pair.baseCurrency());
        assertEquals("JPY", pair.quoteCurrency());
    }

    @Test
    void reutersSuffixIsStripped() {
        assertEquals("USDVND", SymbolDecoder.decode("Reuters", "VND=").symbol());
    }

    @Test
    void otherLengthsAreDecodingErrors() {
        assertThrows(MalformedPayloadException.class, () -> SymbolDecoder.decode("Yahoo Finance", "VNDX1=X"));
        assertThrows(MalformedPayloadException.class, () -> SymbolDecoder.decode("Yahoo Finance", "ABCD=X"));
        assertThrows(MalformedPayloadException.class, () -> SymbolDecoder.decode("Yahoo Finance", null));
    }
}
