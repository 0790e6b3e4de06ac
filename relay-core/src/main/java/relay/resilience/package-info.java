/**
 * The resilience layer: bounded send attempts with exponential backoff, retry-after
 * handling, per-send timeouts and the per-target circuit breaker.
 */
package relay.resilience;
