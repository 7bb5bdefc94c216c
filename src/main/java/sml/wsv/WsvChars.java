package sml.wsv;

/**
 * Whitespace as understood by WSV and SML. This is a fixed set of 25 code points and
 * differs from both {@link Character#isWhitespace(int)} and {@link String#isBlank()}.
 */
public final class WsvChars {

    private WsvChars() {
    }

    public static boolean isWhitespace(int codePoint) {
        switch (codePoint) {
            case 0x0009:
            case 0x000A:
            case 0x000B:
            case 0x000C:
            case 0x000D:
            case 0x0020:
            case 0x0085:
            case 0x00A0:
            case 0x1680:
            case 0x2028:
            case 0x2029:
            case 0x202F:
            case 0x205F:
            case 0x3000:
                return true;
            default:
                return codePoint >= 0x2000 && codePoint <= 0x200A;
        }
    }

    /**
     * @return true if {@code text} is non-empty and made only of whitespace code points
     */
    public static boolean isWhitespace(CharSequence text) {
        if (text == null || text.length() == 0) {
            return false;
        }
        return text.codePoints().allMatch(WsvChars::isWhitespace);
    }

    static boolean containsWhitespace(CharSequence text) {
        return text.codePoints().anyMatch(WsvChars::isWhitespace);
    }
}
