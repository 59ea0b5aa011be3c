package com.monitoring.customgraph.access;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class PrivilegeTest {
    @Test
    void parsesConcatenatedCodes() {
        assertEquals(EnumSet.of(Privilege.IR), Privilege.parse("IR"));
        assertEquals(EnumSet.of(Privilege.AR, Privilege.IR, Privilege.PM), Privilege.parse(" arIRpm "));
    }

    @Test
    void rejectsUnknownOrTruncatedCodes() {
        IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class, () -> Privilege.parse("IRXY"));
        assertTrue(unknown.getMessage().contains("XY"));
        assertThrows(IllegalArgumentException.class, () -> Privilege.parse("IRA"));
        assertThrows(IllegalArgumentException.class, () -> Privilege.parse(null));
    }
}
