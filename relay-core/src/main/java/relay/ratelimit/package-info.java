/**
 * Per-target throughput limits: the sliding send window and the adaptive tuning of
 * rate, burst and recovery.
 */
package relay.ratelimit;
