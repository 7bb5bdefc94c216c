package sml;

import lombok.Builder;
import lombok.Getter;
import sml.wsv.ColumnAlignment;

@Getter
@Builder(toBuilder = true)
public class SmlWriterOptions {

    public static final String DEFAULT_INDENT = "    ";

    /**
     * Written after the content of every element, the root included.
     * {@code null} or an empty string writes the minified {@code -} form.
     */
    @Builder.Default
    private final String endKeyword = SmlParserOptions.DEFAULT_END_KEYWORD;

    /**
     * One level of indentation. Only WSV whitespace is accepted.
     */
    @Builder.Default
    private final String indent = DEFAULT_INDENT;

    /**
     * Alignment of the attribute table of each element.
     */
    @Builder.Default
    private final ColumnAlignment alignment = ColumnAlignment.NONE;

    public static SmlWriterOptions defaults() {
        return builder().build();
    }
}
