package com.opensiddur.controllers;

import com.opensiddur.errors.UnresolvedUrnException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ControllerTest {

    @Test
    void errorBodyNeverHasNullMessage() {
        Map<String, Object> body = Controller.errorBody(new IllegalStateException());
        assertEquals("IllegalStateException", body.get("error"));
        assertFalse(body.containsKey("code"));
    }

    @Test
    void compileErrorsCarryCodeAndLocation() {
        UnresolvedUrnException e = new UnresolvedUrnException("no project defines x", "siddur", "services/morning",
            "/div[1]/transclude[1]");
        Map<String, Object> body = Controller.errorBody(e);
        assertEquals("UnresolvedURN", body.get("code"));
        assertEquals("siddur", body.get("project"));
        assertEquals("services/morning", body.get("document"));
        assertEquals("/div[1]/transclude[1]", body.get("path"));
        assertTrue(((String) body.get("error")).startsWith("UnresolvedURN: no project defines x"));
    }
}
