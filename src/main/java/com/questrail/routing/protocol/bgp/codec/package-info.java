/**
 * BGP codec: header level
 * =============================================================================
 *
 * <p>Wire rules of RFC 4271 section 4.1 live here: the 16-byte all-ones
 * marker, the two-byte total length (19..4096) and the type code.</p>
 *
 * <pre>
 *   TCP byte stream
 *        → length field framing (transport)
 *            → BgpFrameDecoder     (marker, length, type checked here)
 *                → BgpFrame
 *                    → BgpMessageDecoder
 *                        → BgpMessage
 * </pre>
 *
 * <p>Bodies are opaque at this layer.</p>
 */
package com.questrail.routing.protocol.bgp.codec;
