/**
 * Push Transport Port
 * =============================================================================
 *
 * The boundary between a connection and whatever carries its bytes (a TLS
 * socket in production, an in-memory pipe in tests).
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of {@link com.questrail.push.protocol.binary.transport.PushTransport} MUST:
 * <ul>
 *   <li>Perform transport I/O only (no protocol interpretation)</li>
 *   <li>Not establish, renegotiate, or re-establish sessions</li>
 *   <li>Not retry failed writes</li>
 * </ul>
 *
 * <p>Reconnect policy and resubmission stay with the caller of the connection.</p>
 */
package com.questrail.push.protocol.binary.transport;
