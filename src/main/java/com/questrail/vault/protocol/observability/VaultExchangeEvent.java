package com.questrail.vault.protocol.observability;

import com.questrail.vault.protocol.model.VaultMethod;

import java.time.Duration;
import java.time.Instant;

/**
 * Record describing one completed exchange.
 */
public record VaultExchangeEvent(
    Instant timestamp,
    VaultMethod method,
    int requestBodyLength,
    int responseBodyLength,
    Duration elapsed
) {
}
