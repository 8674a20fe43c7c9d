/**
 * Default header codec.
 *
 * <pre>
 *   byte[] message
 *        → marker check
 *        → length check (total, then per type)
 *        → type check
 *        → BgpFrame
 * </pre>
 *
 * <p>Any failure here is a Message Header Error and ends the session.</p>
 */
package com.questrail.routing.protocol.bgp.codec.impl;
