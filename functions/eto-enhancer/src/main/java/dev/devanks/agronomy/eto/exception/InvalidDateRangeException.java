package dev.devanks.agronomy.eto.exception;

public class InvalidDateRangeException extends EtoEnhancementException {
    public InvalidDateRangeException(String message) {
        super(message);
    }

    public InvalidDateRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
