package com.questrail.vault.protocol.observability;

/**
 * No-op implementation of VaultObservabilitySink.
 */
public final class NullObservabilitySink implements VaultObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onExchange(VaultExchangeEvent event) {}

    @Override
    public void onSessionTransition(VaultSessionTransitionEvent event) {}

    @Override
    public void onError(VaultErrorEvent event) {}
}
