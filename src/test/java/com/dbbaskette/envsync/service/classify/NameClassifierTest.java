package com.dbbaskette.envsync.service.classify;

import com.dbbaskette.envsync.model.CanonicalEnvironment;
import com.dbbaskette.envsync.model.SecretScope;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NameClassifierTest {

    @Test
    void devSuffixIsStripped() {
        SecretKey key = NameClassifier.classify("DATABASE_URL_DEV");
        assertEquals("DATABASE_URL", key.baseName());
        assertEquals(CanonicalEnvironment.DEV, key.environment());
        assertEquals("DATABASE_URL_DEV", key.originalName());
        assertEquals(SecretScope.environment(CanonicalEnvironment.DEV), key.environmentScope());
    }

    @Test
    void stagingAndProductionSuffixes() {
        assertEquals(CanonicalEnvironment.STAGING, NameClassifier.classify("API_KEY_STAGING").environment());
        SecretKey prod = NameClassifier.classify("API_KEY_PROD");
        assertEquals(CanonicalEnvironment.PRODUCTION, prod.environment());
        assertEquals("API_KEY", prod.baseName());
    }

    @Test
    void unsuffixedNameIsGlobal() {
        SecretKey key = NameClassifier.classify("DATABASE_URL");
        assertTrue(key.isGlobal());
        assertEquals("DATABASE_URL", key.baseName());
        assertNull(key.environmentScope());
    }

    @Test
    void suffixAloneIsNotStripped() {
        SecretKey key = NameClassifier.classify("_DEV");
        assertTrue(key.isGlobal());
        assertEquals("_DEV", key.baseName());
    }

    @Test
    void suffixMustBeAtTheEnd() {
        assertTrue(NameClassifier.classify("DEV_DATABASE_URL").isGlobal());
        assertTrue(NameClassifier.classify("PRODUCTION_URL").isGlobal());
    }

    @Test
    void blankNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> NameClassifier.classify(" "));
        assertThrows(IllegalArgumentException.class, () -> NameClassifier.classify(null));
    }
}
