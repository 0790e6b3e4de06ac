/**
 * Background redistribution of queued items between targets.
 */
package relay.rebalance;
