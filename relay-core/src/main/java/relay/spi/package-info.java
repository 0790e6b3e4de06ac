/**
 * Service provider interfaces implemented outside the engine: the send function, the
 * priority classifier and the metrics bridge.
 */
package relay.spi;
