package com.conduit.service.resilience;

import com.conduit.exception.GatewayException;
import com.conduit.exception.ProviderTransientException;
import com.conduit.model.CompletionResponse;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Typed result of one provider attempt: a response, or a classified failure.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AttemptOutcome {

    CompletionResponse response;

    FailureKind failureKind;

    /**
     * Always a {@link GatewayException} for failures.
     */
    GatewayException error;

    public static AttemptOutcome success(CompletionResponse response) {
        return new AttemptOutcome(response, null, null);
    }

    public static AttemptOutcome failure(String provider, Throwable error) {
        if (error instanceof ProviderTransientException transientError) {
            return new AttemptOutcome(null,
                    transientError.isUnknown() ? FailureKind.UNKNOWN : FailureKind.TRANSIENT,
                    transientError);
        }
        if (error instanceof GatewayException gatewayError) {
            // permanent provider errors, and any other taxonomy error an adapter chose to raise
            return new AttemptOutcome(null, FailureKind.PERMANENT, gatewayError);
        }
        return new AttemptOutcome(null, FailureKind.UNKNOWN, ProviderTransientException.unknown(provider, error));
    }

    public boolean isSuccess() {
        return response != null;
    }
}
