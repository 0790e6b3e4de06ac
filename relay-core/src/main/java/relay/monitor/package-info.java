/**
 * Background health decay, adaptive rate tuning and performance reporting.
 */
package relay.monitor;
