package de.bsommerfeld.replyradar.app.config;

import de.bsommerfeld.replyradar.core.config.ApplicationMode;
import de.bsommerfeld.replyradar.core.config.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fatal startup preconditions. TEST mode runs fully offline and needs no
 * secrets.
 */
public final class StartupCheck {

    private static final Logger LOG = LoggerFactory.getLogger(StartupCheck.class);

    private StartupCheck() {
    }

    public static void verify(ApplicationMode mode, Credentials credentials) throws MissingConfigurationException {
        if (mode.isTest()) {
            return;
        }
        if (!credentials.hasPrimary() && !credentials.hasSecondary()) {
            throw new MissingConfigurationException("No classifier credential set. Export "
                    + Credentials.PRIMARY_KEY_ENV + " and/or " + Credentials.SECONDARY_KEY_ENV + ".");
        }
        if (!credentials.hasWebhook()) {
            throw new MissingConfigurationException("No notifier webhook set. Export "
                    + Credentials.WEBHOOK_ENV + ".");
        }
        if (!credentials.hasPrimary()) {
            LOG.warn("{} not set, every chunk goes to the secondary classifier", Credentials.PRIMARY_KEY_ENV);
        } else if (!credentials.hasSecondary()) {
            LOG.warn("{} not set, no failover once the primary quota is exhausted",
                    Credentials.SECONDARY_KEY_ENV);
        }
    }
}
