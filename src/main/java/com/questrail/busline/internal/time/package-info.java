/**
 * Time seams for the bus.
 *
 * <p>Bundler intervals and the server tick are measured on a
 * {@link com.questrail.busline.internal.time.MonotonicClock} and scheduled
 * through a {@link com.questrail.busline.internal.time.MonotonicScheduler}.
 * Wall-clock time only timestamps observability events.</p>
 */
package com.questrail.busline.internal.time;
