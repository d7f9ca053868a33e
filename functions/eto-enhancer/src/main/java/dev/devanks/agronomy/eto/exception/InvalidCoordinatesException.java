package dev.devanks.agronomy.eto.exception;

public class InvalidCoordinatesException extends EtoEnhancementException {
    public InvalidCoordinatesException(String message) {
        super(message);
    }
}
