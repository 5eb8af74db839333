package de.bsommerfeld.replyradar.app.config;

import de.bsommerfeld.replyradar.core.config.ApplicationMode;
import de.bsommerfeld.replyradar.core.config.Credentials;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StartupCheckTest {

    @Test
    void verify_prodWithoutAnyClassifierKey_shouldFail() {
        Credentials creds = new Credentials(null, "", "https://hook");

        MissingConfigurationException e = assertThrows(MissingConfigurationException.class,
                () -> StartupCheck.verify(ApplicationMode.PROD, creds));
        assertTrue(e.getMessage().contains(Credentials.PRIMARY_KEY_ENV));
    }

    @Test
    void verify_prodWithoutWebhook_shouldFail() {
        Credentials creds = new Credentials("gemini-key", null, null);

        MissingConfigurationException e = assertThrows(MissingConfigurationException.class,
                () -> StartupCheck.verify(ApplicationMode.PROD, creds));
        assertTrue(e.getMessage().contains(Credentials.WEBHOOK_ENV));
    }

    @Test
    void verify_prodWithSecondaryOnly_shouldPass() {
        assertDoesNotThrow(() -> StartupCheck.verify(ApplicationMode.PROD,
                new Credentials(null, "deepseek-key", "https://hook")));
    }

    @Test
    void verify_testMode_shouldNeedNoSecrets() {
        assertDoesNotThrow(() -> StartupCheck.verify(ApplicationMode.TEST, new Credentials(null, null, null)));
    }
}
