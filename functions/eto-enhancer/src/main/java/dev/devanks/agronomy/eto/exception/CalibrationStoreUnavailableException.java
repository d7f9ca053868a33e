package dev.devanks.agronomy.eto.exception;

public class CalibrationStoreUnavailableException extends EtoEnhancementException {
    public CalibrationStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
