/**
 * Observability events and sinks. The SLF4J sink is the production default.
 */
package com.questrail.busline.observability;
