package org.dxworks.phpast.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AstVersionTest {

    @Test
    void supportedVersionsResolve() {
        assertEquals(AstVersion.V40, AstVersion.of(40));
        assertEquals(AstVersion.V50, AstVersion.of(50));
    }

    @Test
    void otherVersionsAreRejected() {
        UnsupportedAstVersionException e = assertThrows(UnsupportedAstVersionException.class, () -> AstVersion.of(45));
        assertEquals(45, e.getRequestedVersion());
        assertEquals("Unexpected version: want 40 or 50, got 45", e.getMessage());
    }

    @Test
    void onlyVersion50CarriesDeclarationIds() {
        assertFalse(AstVersion.V40.hasDeclIds());
        assertFalse(AstVersion.V40.hasDeclHeaderChildren());
        assertFalse(AstVersion.V40.hasObjectType());
        assertTrue(AstVersion.V50.hasDeclIds());
        assertTrue(AstVersion.V50.hasDeclHeaderChildren());
    }
}
