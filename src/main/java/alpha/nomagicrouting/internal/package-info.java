/**
 * Implementation details; the dispatch engine. Not part of the public API.
 */
package alpha.nomagicrouting.internal;
