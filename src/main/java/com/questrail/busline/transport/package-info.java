/**
 * Transport ports
 * =============================================================================
 *
 * <p>These interfaces are the framework-agnostic boundary between concrete
 * networking code (Netty TCP, Netty UDP, the in-process transport, or a test
 * double) and the channel/bundler core.</p>
 *
 * <p>Everything above an adapter sees only:</p>
 * <ul>
 *   <li>payloads as {@code byte[]}, one complete frame per call</li>
 *   <li>connections as opaque {@link com.questrail.busline.transport.TransportSocket} handles</li>
 *   <li>connect / disconnect / error notifications</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>perform transport I/O only (stream length-prefixing, datagram
 *       addressing and in-process hand-off stay inside the adapter)</li>
 *   <li>not decode frames</li>
 *   <li>not schedule flushes, retries or reconnects</li>
 *   <li>keep framework types (e.g. Netty {@code Channel}, {@code ByteBuf})
 *       inside their own package</li>
 * </ul>
 *
 * <p>Sending is fire-and-forget. No backpressure and no delivery
 * acknowledgment is modeled, so a fast producer feeding a slow or absent peer
 * grows the channel queues without bound.</p>
 */
package com.questrail.busline.transport;
