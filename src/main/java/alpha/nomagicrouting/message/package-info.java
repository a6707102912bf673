/**
 * The request {@link alpha.nomagicrouting.message.Context Context} and the
 * {@link alpha.nomagicrouting.message.ResponseSink ResponseSink} that handler
 * output is written to.
 */
package alpha.nomagicrouting.message;
