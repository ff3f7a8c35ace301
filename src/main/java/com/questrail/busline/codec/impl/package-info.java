/**
 * Jackson-backed encoders.
 *
 * <pre>
 *   Frame(channel, packets)
 *        → ["channel", [p1, p2, ...]]
 *        → ObjectMapper (JSON or CBOR factory)
 *        → byte[]
 * </pre>
 *
 * <p>Any decode failure, or any payload without exactly that two-element
 * shape, decodes to empty and the frame is dropped.</p>
 */
package com.questrail.busline.codec.impl;
