/**
 * Vault Protocol Codec
 * =============================================================================
 *
 * <p>Wire-level rules of the vault protocol. Every frame is laid out as:</p>
 *
 * <pre>
 *   offset 0..2   : "req" | "res"
 *   offset 3      : ':'
 *   offset 4..7   : int32 header length, little-endian (offset where the body starts)
 *   offset 8      : ':'
 *   offset 9..H-1 : (name '=' value ':')*
 *   offset H..end : body
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte stream
 *        → frame reassembly (transport, driven by Content-Length)
 *            → VaultFrameDecoder
 *                → VaultMessage
 * </pre>
 *
 * <h2>Known format limitation</h2>
 * <p>There is no escaping. A header name or value containing {@code ':'} or
 * {@code '='} cannot be represented, so {@code VaultMessage} refuses it when
 * the message is built. On the receive side a header block that is not a
 * sequence of {@code name=value:} entries with distinct names is reported as
 * malformed; nothing attempts to repair it.</p>
 */
package com.questrail.vault.protocol.codec;
