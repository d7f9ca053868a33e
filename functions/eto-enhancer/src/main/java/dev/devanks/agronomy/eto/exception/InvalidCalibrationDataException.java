package dev.devanks.agronomy.eto.exception;

public class InvalidCalibrationDataException extends EtoEnhancementException {
    public InvalidCalibrationDataException(String message) {
        super(message);
    }
}
