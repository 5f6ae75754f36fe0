package io.terraform.tfe.internal;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValidationTest {

    @Test
    void validStringRequiresContent() {
        assertTrue(Validation.validString("acme"));
        assertTrue(Validation.validString(" "));
        assertFalse(Validation.validString(""));
        assertFalse(Validation.validString(null));
    }

    @Test
    void validStringIdAcceptsPathSafeCharactersOnly() {
        assertTrue(Validation.validStringId("ws-2Xy_9.a"));
        assertFalse(Validation.validStringId("ws 1"));
        assertFalse(Validation.validStringId("ws/1"));
        assertFalse(Validation.validStringId("my-org!"));
        assertFalse(Validation.validStringId(""));
        assertFalse(Validation.validStringId(null));
    }
}
