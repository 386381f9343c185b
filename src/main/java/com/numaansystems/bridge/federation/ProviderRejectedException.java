package com.numaansystems.bridge.federation;

/**
 * The provider or target service explicitly refused the exchange.
 *
 * <p>Expected and user-actionable (bad or reused code, no linked identity,
 * missing entitlement), unlike {@link ProviderTransportException}.</p>
 */
public class ProviderRejectedException extends FederationException {

    public ProviderRejectedException(String errorCode, String message) {
        super(errorCode, message);
    }
}
