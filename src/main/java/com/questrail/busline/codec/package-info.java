/**
 * Codec boundary
 * =============================================================================
 *
 * <p>The bus core never looks at wire bytes directly. Outbound batches are
 * handed to an {@link com.questrail.busline.codec.Encoder} as a
 * {@link com.questrail.busline.codec.Frame}; inbound payloads come back the
 * same way.</p>
 *
 * <pre>
 *   Channel batch
 *        → Frame(channel, packets)
 *            → Encoder.encode
 *                → Adapter.send
 *
 *   Adapter bytes
 *        → Encoder.decode   (empty on malformed input, never throws)
 *            → Client routes by channel name
 * </pre>
 *
 * <p>Decode failures are protocol defects and are dropped. They never reach
 * handlers and never propagate to callers.</p>
 */
package com.questrail.busline.codec;
