package dev.devanks.agronomy.eto.exception;

public class InvalidSensorReadingException extends EtoEnhancementException {
    public InvalidSensorReadingException(String message) {
        super(message);
    }
}
