package com.opensiddur.models;

import com.opensiddur.errors.MalformedRangeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UrnTest {

    private static final String GENESIS = "urn:x-opensiddur:text:bible:genesis";

    @Test
    void parsesSinglePassage() {
        Urn urn = Urn.parse(GENESIS + "/1/1");
        assertEquals("x-opensiddur", urn.getNamespace());
        assertEquals("text", urn.getType());
        assertEquals(List.of("bible:genesis", "1", "1"), urn.getPath());
        assertEquals(3, urn.depth());
        assertFalse(urn.isRange());
        assertFalse(urn.isQualified());
        assertEquals(GENESIS + "/1/1", urn.canonical());
    }

    @Test
    void dashInNamespaceIsNotARange() {
        Urn urn = Urn.parse(GENESIS);
        assertFalse(urn.isRange());
        assertEquals(1, urn.depth());
    }

    @Test
    void rangeEndReplacesLastComponent() {
        Urn urn = Urn.parse(GENESIS + "/1/1-3");
        assertTrue(urn.isRange());
        assertEquals(GENESIS + "/1/1", urn.canonical());
        assertEquals(GENESIS + "/1/3", urn.endCanonical());
    }

    @Test
    void rangeEndWithSeveralComponentsReplacesAsMany() {
        Urn urn = Urn.parse(GENESIS + "/1/1-2/3");
        assertEquals(GENESIS + "/1/1", urn.canonical());
        assertEquals(GENESIS + "/2/3", urn.endCanonical());
        assertEquals(urn.start().depth(), urn.end().depth());
    }

    @Test
    void rangeEndDeeperThanStartIsMalformed() {
        assertThrows(MalformedRangeException.class, () -> Urn.parse(GENESIS + "/1-2/3/4"));
    }

    @Test
    void projectQualifierIsSplitOff() {
        Urn urn = Urn.parse(GENESIS + "/1/1-3@jps1917");
        assertEquals("jps1917", urn.getProject());
        assertTrue(urn.isQualified());
        assertEquals(GENESIS + "/1/1", urn.canonical());
        assertEquals("jps1917", urn.end().getProject());
    }

    @Test
    void separateEndMustHaveSameDepth() {
        Urn start = Urn.parse(GENESIS + "/1/1");
        assertEquals(GENESIS + "/1/5", Urn.range(start, Urn.parse(GENESIS + "/1/5")).endCanonical());
        assertThrows(MalformedRangeException.class, () -> Urn.range(start, Urn.parse(GENESIS + "/2")));
    }

    @Test
    void rejectsNonUrns() {
        assertFalse(Urn.isUrn("#local"));
        assertThrows(IllegalArgumentException.class, () -> Urn.parse("http://example.org"));
        assertThrows(IllegalArgumentException.class, () -> Urn.parse("urn:x-opensiddur:text"));
        assertThrows(IllegalArgumentException.class, () -> Urn.parse(GENESIS + "/1/1@"));
    }
}
