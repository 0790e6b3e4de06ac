/**
 * The selection engine and its strategies.
 */
package relay.select;
