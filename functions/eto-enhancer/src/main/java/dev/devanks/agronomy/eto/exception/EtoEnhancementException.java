package dev.devanks.agronomy.eto.exception;

public class EtoEnhancementException extends RuntimeException {
    public EtoEnhancementException(String message) {
        super(message);
    }

    public EtoEnhancementException(String message, Throwable cause) {
        super(message, cause);
    }
}
