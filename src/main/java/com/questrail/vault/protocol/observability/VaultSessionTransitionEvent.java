package com.questrail.vault.protocol.observability;

import com.questrail.vault.session.SessionState;

import java.time.Instant;

/**
 * Record representing an authentication state transition of a vault session.
 */
public record VaultSessionTransitionEvent(
    Instant timestamp,
    String userName,
    SessionState oldState,
    SessionState newState
) {
}
