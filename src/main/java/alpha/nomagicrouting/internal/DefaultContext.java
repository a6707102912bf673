package alpha.nomagicrouting.internal;

import alpha.nomagicrouting.message.Context;
import alpha.nomagicrouting.message.ResponseSink;
import alpha.nomagicrouting.util.Attributes;

import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Context}.<p>
 *
 * The control-transfer methods are delegated to the engine. The rest is plain
 * state, updated by the engine as the dispatch proceeds.
 *
 * @author NoMagicRouting contributors
 */
final class DefaultContext implements Context
{
    private final Dispatch engine;
    private final String method;
    private final String path;
    private final ResponseSink sink;
    private final Attributes attributes;
    private Map<String, String> params;
    private Exception error;
    private boolean handled;

    DefaultContext(Dispatch engine, String method, String path, ResponseSink sink) {
        this.engine     = engine;
        this.method     = method;
        this.path       = path;
        this.sink       = sink;
        this.attributes = new DefaultAttributes();
        this.params     = Map.of();
    }

    @Override
    public String method() {
        return method;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public Map<String, String> params() {
        return params;
    }

    void params(Map<String, String> params) {
        this.params = params;
    }

    @Override
    public Optional<String> param(String name) {
        return Optional.ofNullable(params.get(requireNonNull(name)));
    }

    @Override
    public Exception error() {
        return error;
    }

    /**
     * Records a new pending error.<p>
     *
     * If an error is already pending, it is added as suppressed to the new
     * one.
     */
    void error(Exception e) {
        if (error != null && error != e) {
            e.addSuppressed(error);
        }
        error = e;
    }

    @Override
    public Exception clearError() {
        var e = error;
        error = null;
        return e;
    }

    @Override
    public void next() {
        engine.next();
    }

    @Override
    public void nextRoute() {
        engine.nextRoute();
    }

    @Override
    public void abort() {
        engine.abort();
    }

    @Override
    public boolean isHandled() {
        return handled;
    }

    void handled() {
        handled = true;
    }

    @Override
    public ResponseSink response() {
        return sink;
    }

    @Override
    public Attributes attributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return "DefaultContext{" + method + " " + path + ", params=" + params +
                ", error=" + error + ", handled=" + handled + '}';
    }
}
