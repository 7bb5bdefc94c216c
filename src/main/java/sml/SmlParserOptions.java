package sml;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder(toBuilder = true)
public class SmlParserOptions {

    public static final String DEFAULT_END_KEYWORD = "End";
    public static final int DEFAULT_MAX_DEPTH = 4096;

    /**
     * Keyword closing the innermost open element, compared ignoring case.
     * {@code null} means a bare {@code -} closes elements.
     */
    @Builder.Default
    private final String endKeyword = DEFAULT_END_KEYWORD;

    /**
     * Take the end keyword from the last row of the document when that row holds a single value.
     */
    @Builder.Default
    private final boolean detectEndKeyword = false;

    /**
     * Maximum number of simultaneously open elements, the root included.
     */
    @Builder.Default
    private final int maxDepth = DEFAULT_MAX_DEPTH;

    public static SmlParserOptions defaults() {
        return builder().build();
    }
}
