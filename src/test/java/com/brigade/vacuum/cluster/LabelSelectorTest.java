package com.brigade.vacuum.cluster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LabelSelectorTest {

    @Test
    @DisplayName("build selector requires both component and heritage")
    void buildRecordsSelector() {
        assertTrue(LabelSelector.BUILD_RECORDS.matches(
                Map.of("component", "build", "heritage", "brigade", "build", "abc")));
        assertFalse(LabelSelector.BUILD_RECORDS.matches(Map.of("component", "build")));
        assertFalse(LabelSelector.BUILD_RECORDS.matches(
                Map.of("component", "job", "heritage", "brigade")));
    }

    @Test
    @DisplayName("empty selector matches everything")
    void everything() {
        assertTrue(LabelSelector.EVERYTHING.isEverything());
        assertTrue(LabelSelector.EVERYTHING.matches(Map.of()));
        assertTrue(LabelSelector.EVERYTHING.matches(Map.of("app", "x")));
    }

    @Test
    @DisplayName("renders in Kubernetes selector syntax")
    void rendering() {
        assertEquals("component=build,heritage=brigade", LabelSelector.BUILD_RECORDS.toString());
        assertEquals("", LabelSelector.EVERYTHING.toString());
    }
}
