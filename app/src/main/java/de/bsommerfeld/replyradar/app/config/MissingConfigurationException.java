package de.bsommerfeld.replyradar.app.config;

/**
 * Raised before the injector is built when a precondition for a run is not
 * met. The application cannot do anything useful without it and exits.
 */
public class MissingConfigurationException extends Exception {

    public MissingConfigurationException(String message) {
        super(message);
    }
}
