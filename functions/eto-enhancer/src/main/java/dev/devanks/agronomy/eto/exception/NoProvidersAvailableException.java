package dev.devanks.agronomy.eto.exception;

public class NoProvidersAvailableException extends EtoEnhancementException {
    public NoProvidersAvailableException(String message) {
        super(message);
    }
}
