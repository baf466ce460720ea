package com.questrail.vault.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of VaultObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jVaultObservabilitySink implements VaultObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jVaultObservabilitySink.class);

    @Override
    public void onExchange(VaultExchangeEvent event) {
        log.debug("Vault exchange {}: sent {} bytes, received {} bytes in {} ms",
            event.method().wireName(),
            event.requestBodyLength(),
            event.responseBodyLength(),
            event.elapsed().toMillis());
    }

    @Override
    public void onSessionTransition(VaultSessionTransitionEvent event) {
        log.info("Vault session for '{}': {} -> {}",
            event.userName(),
            event.oldState(),
            event.newState());
    }

    @Override
    public void onError(VaultErrorEvent event) {
        log.error("Vault exchange {} failed: {}", event.method().wireName(), event.message(), event.cause());
    }
}
