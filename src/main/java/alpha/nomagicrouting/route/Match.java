package alpha.nomagicrouting.route;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * The result of a path accepted by a {@link Matchable}.<p>
 *
 * The accepted path is always equal to {@code consumed() + remaining()}. The
 * remaining path is what the children of a router will be matched against.
 *
 * @param consumed  the prefix of the path consumed by the pattern
 * @param remaining the rest of the path
 * @param params    parameters captured by the pattern's tokens (unmodifiable)
 *
 * @see Matchable#matchPath(String)
 *
 * @author NoMagicRouting contributors
 */
public record Match(String consumed, String remaining, Map<String, String> params)
{
    /**
     * Initializes this object.
     *
     * @param consumed  the prefix of the path consumed by the pattern
     * @param remaining the rest of the path
     * @param params    parameters captured by the pattern's tokens
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public Match {
        requireNonNull(consumed);
        requireNonNull(remaining);
        requireNonNull(params);
    }
}
