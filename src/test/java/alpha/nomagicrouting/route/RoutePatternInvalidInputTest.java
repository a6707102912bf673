package alpha.nomagicrouting.route;

import org.junit.jupiter.api.Test;

import java.util.regex.PatternSyntaxException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Provokes exceptions from {@link RoutePattern#parse(String)} caused by invalid
 * specifications.<p>
 *
 * For the inverse (what compiles), see {@link RoutePatternTest}.
 *
 * @author NoMagicRouting contributors
 */
class RoutePatternInvalidInputTest
{
    @Test
    void null_spec() {
        assertThatThrownBy(() -> RoutePattern.parse(null))
                .isExactlyInstanceOf(NullPointerException.class);
    }

    @Test
    void empty_method_in_middle() {
        assertInvalid("GET,,POST /x", "Empty method in method list.");
    }

    @Test
    void empty_method_last() {
        assertInvalid("GET, /x", "Empty method in method list.");
    }

    @Test
    void empty_method_first() {
        assertInvalid(",GET /x", "Empty method in method list.");
    }

    @Test
    void token_not_terminated() {
        assertInvalid("/<id", "Token at index 1 of the path is not terminated.");
    }

    @Test
    void token_not_terminated_index_is_relative_to_path() {
        assertInvalid("GET /a/<id", "Token at index 3 of the path is not terminated.");
    }

    @Test
    void token_name_contains_less_than() {
        assertInvalid("/<a<b>", "Token at index 1 of the path is not terminated.");
    }

    @Test
    void token_regex_not_terminated() {
        assertInvalid("/<id:\\d+", "Token \"id\" is not terminated.");
    }

    @Test
    void token_name_empty_1() {
        assertInvalid("/<>", "Empty token name.");
    }

    @Test
    void token_name_empty_2() {
        assertInvalid("/<:\\d+>", "Empty token name.");
    }

    @Test
    void token_name_repeated() {
        assertInvalid("/<a>/<a:\\d+>", "Repeated token name \"a\".");
    }

    @Test
    void token_regex_empty() {
        assertInvalid("/<a:>", "Empty regex of token \"a\".");
    }

    @Test
    void token_regex_invalid() {
        assertThatThrownBy(() -> RoutePattern.parse("/<a:*>"))
                .isExactlyInstanceOf(RoutePatternInvalidException.class)
                .hasMessage("Invalid regex of token \"a\". Specification: \"/<a:*>\"")
                .hasCauseExactlyInstanceOf(PatternSyntaxException.class);
    }

    @Test
    void tokens_define_same_inner_group() {
        var spec = "/<a:(?<g>\\w+)>/<b:(?<g>\\w+)>";
        assertThatThrownBy(() -> RoutePattern.parse(spec))
                .isExactlyInstanceOf(RoutePatternInvalidException.class)
                .hasMessage("Invalid regex of path. Specification: \"" + spec + "\"")
                .hasCauseExactlyInstanceOf(PatternSyntaxException.class);
    }

    @Test
    void token_regex_numbered_back_reference() {
        assertInvalid("/<a:(\\w)\\1>",
                "Numbered back-reference in regex of token \"a\", use a named group.");
    }

    @Test
    void exception_carries_spec() {
        assertThatThrownBy(() -> RoutePattern.parse("/<>"))
                .isExactlyInstanceOf(RoutePatternInvalidException.class)
                .extracting(e -> ((RoutePatternInvalidException) e).spec())
                .isEqualTo("/<>");
    }

    private static void assertInvalid(String spec, String message) {
        assertThatThrownBy(() -> RoutePattern.parse(spec))
                .isExactlyInstanceOf(RoutePatternInvalidException.class)
                .hasMessage(message + " Specification: \"" + spec + "\"")
                .hasNoCause();
    }
}
