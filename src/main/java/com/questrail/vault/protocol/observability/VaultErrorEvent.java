package com.questrail.vault.protocol.observability;

import com.questrail.vault.protocol.model.VaultMethod;

import java.time.Instant;

/**
 * Record representing a raised error in the vault client.
 */
public record VaultErrorEvent(
    Instant timestamp,
    VaultMethod method,
    String message,
    Throwable cause
) {
}
