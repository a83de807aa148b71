package de.bsommerfeld.dbkeeper.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationModeTest {

    @Test
    void resolve_shouldDefaultToProdWhenNothingIsSet() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve(null, null));
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve("  ", ""));
    }

    @Test
    void resolve_shouldPreferPropertyOverEnvironment() {
        assertEquals(ApplicationMode.TEST, ApplicationMode.resolve("test", "PROD"));
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve("PROD", "TEST"));
    }

    @Test
    void resolve_shouldFallBackToEnvironmentWhenPropertyBlank() {
        assertEquals(ApplicationMode.TEST, ApplicationMode.resolve("", " Test "));
    }

    @Test
    void resolve_shouldDefaultToProdForUnknownValue() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve("staging", null));
    }

    @Test
    void get_shouldReadSystemProperty() {
        String original = System.getProperty(ApplicationMode.PROPERTY);
        try {
            System.setProperty(ApplicationMode.PROPERTY, "TEST");
            assertEquals(ApplicationMode.TEST, ApplicationMode.get());
        } finally {
            if (original != null)
                System.setProperty(ApplicationMode.PROPERTY, original);
            else
                System.clearProperty(ApplicationMode.PROPERTY);
        }
    }

    @Test
    void isTest_shouldOnlyHoldForTestMode() {
        assertTrue(ApplicationMode.TEST.isTest());
        assertFalse(ApplicationMode.PROD.isTest());
    }
}
