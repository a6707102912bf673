package alpha.nomagicrouting.route;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static java.util.Collections.emptySortedSet;
import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSortedSet;
import static java.util.Objects.requireNonNull;

/**
 * A compiled route specification; the method set and path matcher shared by
 * {@link Router} and {@link Route}.<p>
 *
 * The specification has the form {@code "[METHOD[,METHOD...] ]path"}. For
 * example:
 *
 * <pre>
 *   "/users"                      any method, literal path
 *   "GET,POST /users"             GET or POST, literal path
 *   "GET /users/&lt;id:\d+&gt;"   GET, path with a token
 * </pre>
 *
 * The method list is an upper-case, comma-separated list followed by exactly
 * one space. A specification without a method list matches any method.<p>
 *
 * The path is literal text interleaved with tokens of the form {@code
 * <name:regex>} or {@code <name>}. A token without a regex matches one or more
 * characters except '/' ({@code [^/]+}). Each token captures its match as a
 * path parameter of the given name. Literal text is compared as-is; characters
 * such as '.' or '*' have no special meaning outside a token.<p>
 *
 * A token regex may not refer to a group by number. A named group works, for
 * example {@code <pair:(?<c>\w)(?:\k<c>)>}; the back-reference is put in a
 * group so that its '>' does not end the token.<p>
 *
 * A path is matched as a <i>prefix</i>. The pattern "/users" accepts
 * "/users/42" with "/42" remaining. A router hands the remaining path to its
 * children, which is how nested routers consume one segment of the path each.
 * A pattern without tokens is matched using {@link String#startsWith(String)};
 * the result is the same as if it was compiled.<p>
 *
 * The implementation is immutable and thread-safe.
 *
 * @author NoMagicRouting contributors
 */
public final class RoutePattern
{
    private static final String DEFAULT_TOKEN_REGEX = "[^/]+";

    // Synthetic group names, the user's names need not be valid Java group names
    private static final String GROUP_PREFIX = "nmrToken";

    private static final RoutePattern ANY = new RoutePattern(
            "*", emptySortedSet(), "", Pattern.compile(".*", Pattern.DOTALL), List.of());

    /**
     * Returns a pattern matching any method and any path.<p>
     *
     * The pattern consumes the entire path.
     *
     * @return a pattern matching any method and any path
     */
    public static RoutePattern any() {
        return ANY;
    }

    /**
     * Compiles a route specification.
     *
     * @param spec route specification
     *
     * @return the compiled pattern
     *
     * @throws NullPointerException
     *             if {@code spec} is {@code null}
     *
     * @throws RoutePatternInvalidException
     *             if the method list contains an empty method, or
     *             if a token is not terminated, or
     *             if a token name is empty or repeated, or
     *             if a token regex is empty or does not compile, or
     *             if a token regex has a numbered back-reference, or
     *             if the regexes of all tokens combined do not compile
     */
    public static RoutePattern parse(String spec) {
        requireNonNull(spec);
        SortedSet<String> methods = emptySortedSet();
        String path = spec;
        int space = spec.indexOf(' ');
        if (space > 0 && isMethodList(spec, space)) {
            methods = parseMethods(spec, space);
            path = spec.substring(space + 1);
        }
        return compile(spec, methods, path);
    }

    private static boolean isMethodList(String spec, int end) {
        for (int i = 0; i < end; ++i) {
            char c = spec.charAt(i);
            if (c != ',' && (c < 'A' || c > 'Z')) {
                return false;
            }
        }
        return true;
    }

    private static SortedSet<String> parseMethods(String spec, int end) {
        SortedSet<String> methods = new TreeSet<>();
        for (String m : spec.substring(0, end).split(",", -1)) {
            if (m.isEmpty()) {
                throw new RoutePatternInvalidException(spec, "Empty method in method list.");
            }
            methods.add(m);
        }
        return unmodifiableSortedSet(methods);
    }

    private static RoutePattern compile(String spec, SortedSet<String> methods, String path) {
        StringBuilder regex = new StringBuilder();
        List<String> names = new ArrayList<>();
        Set<String> unique = new HashSet<>();
        int pos = 0;
        for (int lt; (lt = path.indexOf('<', pos)) != -1; ) {
            if (lt > pos) {
                regex.append(Pattern.quote(path.substring(pos, lt)));
            }
            int nameEnd = nameEnd(spec, path, lt + 1);
            String name = path.substring(lt + 1, nameEnd);
            if (name.isEmpty()) {
                throw new RoutePatternInvalidException(spec, "Empty token name.");
            }
            if (!unique.add(name)) {
                throw new RoutePatternInvalidException(spec,
                        "Repeated token name \"" + name + "\".");
            }
            final String expr;
            if (path.charAt(nameEnd) == ':') {
                int end = regexEnd(path, nameEnd + 1);
                if (end == -1) {
                    throw new RoutePatternInvalidException(spec,
                            "Token \"" + name + "\" is not terminated.");
                }
                expr = path.substring(nameEnd + 1, end);
                if (expr.isEmpty()) {
                    throw new RoutePatternInvalidException(spec,
                            "Empty regex of token \"" + name + "\".");
                }
                pos = end + 1;
            } else {
                expr = DEFAULT_TOKEN_REGEX;
                pos = nameEnd + 1;
            }
            try {
                Pattern.compile(expr);
            } catch (PatternSyntaxException e) {
                throw new RoutePatternInvalidException(spec,
                        "Invalid regex of token \"" + name + "\".", e);
            }
            if (hasNumberedBackReference(expr)) {
                throw new RoutePatternInvalidException(spec,
                        "Numbered back-reference in regex of token \"" + name +
                        "\", use a named group.");
            }
            regex.append("(?<").append(GROUP_PREFIX).append(names.size()).append('>')
                 .append(expr)
                 .append(')');
            names.add(name);
        }
        if (names.isEmpty()) {
            return new RoutePattern(spec, methods, path, null, List.of());
        }
        if (pos < path.length()) {
            regex.append(Pattern.quote(path.substring(pos)));
        }
        final Pattern compiled;
        try {
            compiled = Pattern.compile(regex.toString());
        } catch (PatternSyntaxException e) {
            // For example, tokens defining the same inner group name
            throw new RoutePatternInvalidException(spec, "Invalid regex of path.", e);
        }
        return new RoutePattern(spec, methods, path, compiled, names);
    }

    /**
     * Returns true if the regex refers to a group by number ({@code \1}).<p>
     *
     * Each token is wrapped in a capturing group of its own, so group numbers
     * in a token do not count from the token.
     */
    private static boolean hasNumberedBackReference(String regex) {
        for (int i = 0; i < regex.length() - 1; ++i) {
            if (regex.charAt(i) != '\\') {
                continue;
            }
            char c = regex.charAt(++i);
            if (c == 'Q') {
                int end = regex.indexOf("\\E", i + 1);
                if (end == -1) {
                    return false;
                }
                i = end + 1;
            } else if (c >= '1' && c <= '9') {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the index of the ':' or '>' that terminates a token name
     * starting at {@code from}.
     */
    private static int nameEnd(String spec, String path, int from) {
        for (int i = from; i < path.length(); ++i) {
            switch (path.charAt(i)) {
                case ':', '>':
                    return i;
                case '<':
                    throw new RoutePatternInvalidException(spec,
                            "Token at index " + (from - 1) + " of the path is not terminated.");
                default:
                    // continue
            }
        }
        throw new RoutePatternInvalidException(spec,
                "Token at index " + (from - 1) + " of the path is not terminated.");
    }

    /**
     * Returns the index of the '>' that terminates a token regex starting at
     * {@code from}, or -1 if there is none.<p>
     *
     * A '>' does not terminate the regex if it is escaped, or inside a
     * character class, a group or a quantifier. This allows tokens such as
     * {@code <name:(?<first>\w+)>}.
     */
    private static int regexEnd(String path, int from) {
        int depth = 0;
        boolean inClass = false;
        for (int i = from; i < path.length(); ++i) {
            char c = path.charAt(i);
            if (c == '\\') {
                ++i;
            } else if (inClass) {
                if (c == ']') {
                    inClass = false;
                }
            } else if (c == '[') {
                inClass = true;
            } else if (c == '(' || c == '{') {
                ++depth;
            } else if ((c == ')' || c == '}') && depth > 0) {
                --depth;
            } else if (c == '>' && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private final String spec;
    private final SortedSet<String> methods;
    private final String path;
    // null if literal
    private final Pattern regex;
    private final String[] names;
    private final String[] groups;

    private RoutePattern(
            String spec, SortedSet<String> methods, String path,
            Pattern regex, List<String> names)
    {
        this.spec    = spec;
        this.methods = methods;
        this.path    = path;
        this.regex   = regex;
        this.names   = names.toArray(String[]::new);
        this.groups  = new String[this.names.length];
        for (int i = 0; i < groups.length; ++i) {
            groups[i] = GROUP_PREFIX + i;
        }
    }

    /**
     * Returns the accepted methods.
     *
     * @return the accepted methods (unmodifiable, empty if any method is accepted)
     */
    public SortedSet<String> methods() {
        return methods;
    }

    /**
     * Returns the path part of the specification.
     *
     * @return the path part of the specification
     */
    public String path() {
        return path;
    }

    /**
     * Returns the names of the tokens, in the order they were declared.
     *
     * @return the names of the tokens (unmodifiable)
     */
    public List<String> tokenNames() {
        return List.of(names);
    }

    /**
     * Returns {@code true} if the path is matched using a plain prefix
     * comparison.
     *
     * @return {@code true} if the path is matched using a plain prefix
     *         comparison
     */
    public boolean isLiteral() {
        return regex == null;
    }

    /**
     * Matches a method and a path.<p>
     *
     * If methods are declared and the given method is not one of them, the
     * path is not consulted.
     *
     * @param method of request
     * @param path   to match
     *
     * @return the match, or {@code null} if rejected
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public Match match(String method, String path) {
        requireNonNull(method);
        if (!methods.isEmpty() && !methods.contains(method)) {
            return null;
        }
        return matchPath(path);
    }

    /**
     * Matches a path.
     *
     * @param path to match
     *
     * @return the match, or {@code null} if rejected
     *
     * @throws NullPointerException if {@code path} is {@code null}
     */
    public Match matchPath(String path) {
        if (regex == null) {
            return path.startsWith(this.path) ?
                    new Match(this.path, path.substring(this.path.length()), Map.of()) :
                    null;
        }
        Matcher m = regex.matcher(path);
        if (!m.lookingAt()) {
            return null;
        }
        Map<String, String> params;
        if (names.length == 0) {
            params = Map.of();
        } else {
            params = new LinkedHashMap<>(names.length * 2);
            for (int i = 0; i < names.length; ++i) {
                params.put(names[i], m.group(groups[i]));
            }
            params = unmodifiableMap(params);
        }
        int end = m.end();
        return new Match(path.substring(0, end), path.substring(end), params);
    }

    /**
     * Returns the specification this pattern was compiled from.
     *
     * @return the specification this pattern was compiled from
     */
    @Override
    public String toString() {
        return spec;
    }
}
