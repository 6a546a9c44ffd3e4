package in.fxledger.service.normalize;

import in.fxledger.domain.common.MalformedPayloadException;
import in.fxledger.domain.model.CurrencyPair;

import java.util.Locale;

/**
 * Decodes provider FX symbols such as {@code VND=X}, {@code EURUSD=X} or {@code EUR=}.
 *
 * A 3-letter code is quoted against USD; a 6-letter code is split in half.
 */
public final class SymbolDecoder {
    private static final String DEFAULT_BASE = "USD";

    public static CurrencyPair decode(String source, String symbol) {
        if (symbol == null) {
            throw new MalformedPayloadException(source, "missing symbol");
        }
        String code = symbol.trim().toUpperCase(Locale.ROOT);
        if (code.endsWith("=X")) {
            code = code.substring(0, code.length() - 2);
        } else if (code.endsWith("=")) {
            code = code.substring(0, code.length() - 1);
        }
        if (!code.chars().allMatch(Character::isLetter)) {
            throw new MalformedPayloadException(source, "cannot decode symbol: " + symbol);
        }
        if (code.length() == 3) {
            return CurrencyPair.of(DEFAULT_BASE, code);
        }
        if (code.length() == 6) {
            return CurrencyPair.of(code.substring(0, 3), code.substring(3));
        }
        throw new MalformedPayloadException(source, "cannot decode symbol: " + symbol);
    }

    private SymbolDecoder() {}
}
