package com.brigade.vacuum.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setPolicy puts passId and policy in MDC")
    void setPolicy() {
        MdcContext.setPolicy("VAC-1234abcd", "age");
        assertEquals("VAC-1234abcd", MDC.get("passId"));
        assertEquals("age", MDC.get("policy"));
    }

    @Test
    @DisplayName("clearBuild removes only the build ID")
    void clearBuild() {
        MdcContext.setPass("VAC-1234abcd");
        MdcContext.setBuild("01hx");
        MdcContext.clearBuild();
        assertNull(MDC.get("buildId"));
        assertEquals("VAC-1234abcd", MDC.get("passId"));
    }

    @Test
    @DisplayName("clear removes all vacuum MDC keys")
    void clear() {
        MdcContext.setPolicy("VAC-1234abcd", "count");
        MdcContext.setBuild("01hx");
        MdcContext.clear();
        assertNull(MDC.get("passId"));
        assertNull(MDC.get("policy"));
        assertNull(MDC.get("buildId"));
    }
}
