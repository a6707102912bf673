/**
 * Adapts a {@link alpha.nomagicrouting.route.Router Router} to the HTTP server
 * built into the JDK ({@code com.sun.net.httpserver}).
 */
package alpha.nomagicrouting.jdkhttp;
