package in.fxledger.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    private static final String KEY = "FXLEDGER_ENV_TEST_KEY";

    @AfterEach
    void clear() {
        System.clearProperty(KEY);
    }

    @Test
    void defaultWhenUnset() {
        assertEquals("fallback", Env.get(KEY, "fallback"));
        assertEquals(7, Env.getInt(KEY, 7));
        assertTrue(Env.getBool(KEY, true));
    }

    @Test
    void systemPropertyIsUsed() {
        System.setProperty(KEY, "42");

        assertEquals("42", Env.get(KEY, "x"));
        assertEquals(42, Env.getInt(KEY, 0));
        assertEquals(42L, Env.getLong(KEY, 0L));
    }

    @Test
    void booleansAcceptTrueAndOne() {
        System.setProperty(KEY, "1");
        assertTrue(Env.getBool(KEY, false));

        System.setProperty(KEY, "no");
        assertFalse(Env.getBool(KEY, true));
    }

    @Test
    void listsDropBlanks() {
        assertEquals(List.of("a", "b"), Env.splitList(" a, ,b,"));

        System.setProperty(KEY, "USD/VND,EUR/VND");
        assertEquals(List.of("USD/VND", "EUR/VND"), Env.getList(KEY, List.of()));
    }
}
