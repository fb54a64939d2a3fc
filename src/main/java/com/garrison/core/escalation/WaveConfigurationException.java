package com.garrison.core.escalation;

/**
 * Thrown while wiring when the configured wave table cannot be used.
 */
public class WaveConfigurationException extends RuntimeException {

    public WaveConfigurationException(String message) {
        super(message);
    }
}
