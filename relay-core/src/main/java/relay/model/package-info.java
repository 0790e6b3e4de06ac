/**
 * Value types shared across the dispatch engine: priority classes and the
 * read-only statistics returned by {@link relay.Relay#stats()}.
 */
package relay.model;
