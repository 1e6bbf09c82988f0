// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.codec;

import java.time.DateTimeException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses the text form of a value, reporting failure instead of throwing.
 *
 * <p>Parsers are registered per class in {@link TextParsers}. The decoder consults them
 * after its built-in rules and before the codec hooks; an empty result makes the decoder
 * return the type default.
 *
 * @param <T> the parsed type
 */
@FunctionalInterface
public interface TextParser<T> {

    /**
     * Parses {@code text}.
     *
     * @param text non-empty text
     * @return the parsed value, or empty if {@code text} is not a valid representation
     */
    Optional<T> tryParse(String text);

    /**
     * Adapts a throwing parse function. {@link IllegalArgumentException} (which includes
     * {@link NumberFormatException}) and {@link DateTimeException} are treated as parse
     * failures; anything else propagates.
     *
     * @param parse the parse function, e.g. {@code Integer::valueOf}
     * @param <T>   the parsed type
     * @return a parser
     */
    static <T> TextParser<T> lenient(final Function<String, ? extends T> parse) {
        Objects.requireNonNull(parse, "parse");
        return text -> {
            try {
                return Optional.<T>ofNullable(parse.apply(text));
            } catch (IllegalArgumentException | DateTimeException e) {
                return Optional.empty();
            }
        };
    }
}
