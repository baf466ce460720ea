package com.questrail.vault.protocol.observability;

/**
 * Main interface for receiving vault client observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Events never carry bodies, passwords, keys or session tokens.</p>
 */
public interface VaultObservabilitySink {
    /**
     * Called after a request/response exchange completed.
     * @param event the exchange details
     */
    void onExchange(VaultExchangeEvent event);

    /**
     * Called when the authentication state of a session changes.
     * @param event the transition event details
     */
    void onSessionTransition(VaultSessionTransitionEvent event);

    /**
     * Called when an exchange fails with a raised error.
     * @param event the error event
     */
    void onError(VaultErrorEvent event);
}
