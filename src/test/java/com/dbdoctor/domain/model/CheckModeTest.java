package com.dbdoctor.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CheckMode")
class CheckModeTest {

    @Test
    @DisplayName("Should parse mode names case-insensitively")
    void shouldParseModes() {
        assertEquals(CheckMode.INTERACTIVE, CheckMode.parse("interactive"));
        assertEquals(CheckMode.EXECUTE, CheckMode.parse(" EXECUTE "));
        assertEquals(CheckMode.CHECK, CheckMode.parse("Check"));
    }

    @Test
    @DisplayName("Should reject unknown modes")
    void shouldRejectUnknownModes() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> CheckMode.parse("fix"));
        assertTrue(e.getMessage().contains("interactive, execute, check"));
    }
}
