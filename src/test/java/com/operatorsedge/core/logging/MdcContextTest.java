package com.operatorsedge.core.logging;

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
    @DisplayName("setTurn puts turnId in MDC")
    void setTurn() {
        MdcContext.setTurn("a1b2c3d4");
        assertEquals("a1b2c3d4", MDC.get("turnId"));
    }

    @Test
    @DisplayName("setGear and setJunction put gear and junctionId in MDC")
    void setGearAndJunction() {
        MdcContext.setGear("PATROL");
        MdcContext.setJunction("j-1");
        assertEquals("PATROL", MDC.get("gear"));
        assertEquals("j-1", MDC.get("junctionId"));
    }

    @Test
    @DisplayName("clear removes all dispatch MDC keys")
    void clear() {
        MdcContext.setTurn("a1b2c3d4");
        MdcContext.setGear("ACTIVE");
        MdcContext.setJunction("j-1");
        MdcContext.clear();
        assertNull(MDC.get("turnId"));
        assertNull(MDC.get("gear"));
        assertNull(MDC.get("junctionId"));
    }
}
