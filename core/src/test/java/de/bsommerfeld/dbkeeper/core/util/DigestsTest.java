package de.bsommerfeld.dbkeeper.core.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class DigestsTest {

    @Test
    void sha256_shouldMatchKnownVector() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                Digests.sha256("abc".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void queryDigest_shouldIgnoreWhitespaceAndCase() {
        assertEquals(Digests.queryDigest("SELECT *  FROM t\nWHERE t.x = 1"),
                Digests.queryDigest("select * from t where t.x = 1"));
    }

    @Test
    void queryDigest_shouldDifferForDifferentQueries() {
        assertNotEquals(Digests.queryDigest("SELECT 1"), Digests.queryDigest("SELECT 2"));
    }

    @Test
    void queryDigest_shouldBeSixteenHexChars() {
        assertTrue(Digests.queryDigest("SELECT 1").matches("[0-9a-f]{16}"));
    }
}
