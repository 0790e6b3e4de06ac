/**
 * Background eviction of stale queued items.
 */
package relay.reaper;
