/**
 * Binary Push Codec
 * =============================================================================
 *
 * <p>Wire-level rules of the legacy binary push protocol, and nothing else.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   Payload + id
 *        → PushItemEncoder        (one item, localId left at 0)
 *            → FrameBatcher       (frame envelope, localId, size bound)
 *                → PushTransport
 *
 *   PushTransport (6 bytes)
 *        → ErrorResponseDecoder
 *            → PushErrorEvent
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Encoders never touch the transport and never see other items.</li>
 *   <li>Encoding failures are reported with {@link
 *       com.questrail.push.protocol.binary.codec.PushEncodeException}; the
 *       decision to tear the connection down belongs to the driver.</li>
 *   <li>{@link com.questrail.push.protocol.binary.codec.PushFrameDecoder} is
 *       the peer-side inverse, used to inspect what was written.</li>
 * </ul>
 */
package com.questrail.push.protocol.binary.codec;
