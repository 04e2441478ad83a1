package org.opensds.anomaly.normalize;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PayloadFieldsTest {

    @Test
    void epochMillisAreKept() throws Exception {
        assertEquals(1710000000123L, PayloadFields.parseTimestamp("1710000000123"));
    }

    @Test
    void epochSecondsAreScaled() throws Exception {
        assertEquals(1710000000000L, PayloadFields.parseTimestamp("1710000000"));
        assertEquals(1710000000500L, PayloadFields.parseTimestamp("1710000000.5"));
    }

    @Test
    void isoTextIsParsed() throws Exception {
        assertEquals(1710000000000L, PayloadFields.parseTimestamp("2024-03-09T16:00:00Z"));
        assertEquals(1710000000000L, PayloadFields.parseTimestamp("2024-03-09T17:00:00+01:00"));
    }

    @Test
    void garbageTimestampFails() {
        NormalizationException ex = assertThrows(NormalizationException.class,
                () -> PayloadFields.parseTimestamp("09/03/2024"));
        assertEquals("invalid_timestamp", ex.reason());
    }

    @Test
    void blankValueIsMissing() {
        NormalizationException ex = assertThrows(NormalizationException.class, () -> PayloadFields.parseValue(" "));
        assertEquals("missing_value", ex.reason());
    }

    @Test
    void infiniteValueIsRejected() {
        NormalizationException ex = assertThrows(NormalizationException.class,
                () -> PayloadFields.parseValue("Infinity"));
        assertEquals("non_finite_value", ex.reason());
    }
}
