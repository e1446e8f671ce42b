package io.walkie.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HashingTest {

    @Test
    void hmacMatchesRfc4231Vector() {
        String mac = Hashing.hmacSha256Hex("Jefe".getBytes(StandardCharsets.UTF_8), "what do ya want for nothing?");
        assertEquals("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843", mac);
    }

    @Test
    void digestComparisonIgnoresCaseAndRejectsNull() {
        assertTrue(Hashing.digestsEqual("abcdef", "ABCDEF"));
        assertFalse(Hashing.digestsEqual("abcdef", "abcdee"));
        assertFalse(Hashing.digestsEqual("abcdef", null));
    }
}
