package dev.devanks.agronomy.eto.exception;

import dev.devanks.agronomy.eto.model.ProviderId;
import lombok.Getter;

/**
 * A single weather provider could not deliver usable data. Recoverable inside an ensemble,
 * fatal when the caller asked for that provider alone.
 */
@Getter
public class ProviderUnavailableException extends EtoEnhancementException {

    public enum Reason {
        MISSING_API_KEY, INVALID_API_KEY, RATE_LIMITED, OUTAGE, UNSUPPORTED_REQUEST, MALFORMED_RESPONSE, NO_DATA
    }

    private final ProviderId provider;
    private final Reason reason;

    public ProviderUnavailableException(ProviderId provider, Reason reason, String message) {
        super(format(provider, reason, message));
        this.provider = provider;
        this.reason = reason;
    }

    public ProviderUnavailableException(ProviderId provider, Reason reason, String message, Throwable cause) {
        super(format(provider, reason, message), cause);
        this.provider = provider;
        this.reason = reason;
    }

    private static String format(ProviderId provider, Reason reason, String message) {
        return String.format("Provider %s unavailable (%s): %s",
                provider != null ? provider.getTag() : "unknown", reason, message);
    }
}
