/**
 * Vault Transport Ports
 * =============================================================================
 *
 * <p>These interfaces define the framework-agnostic boundary between a
 * concrete networking implementation (Netty TCP/TLS, or a test double) and the
 * protocol client.</p>
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Raw frames as {@code byte[]}</li>
 *   <li>Classified {@code VaultTransportException} / {@code VaultFramingException} failures</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Open one connection per exchange and release it on every exit path</li>
 *   <li>Complete any TLS handshake before protocol bytes are written</li>
 *   <li>Never retry</li>
 * </ul>
 */
package com.questrail.vault.protocol.transport;
