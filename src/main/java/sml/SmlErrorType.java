package sml;

public enum SmlErrorType {
    STRING_NOT_CLOSED,
    INVALID_CHARACTER_AFTER_STRING,
    INVALID_DOUBLE_QUOTE_IN_VALUE,

    EMPTY_DOCUMENT,
    INVALID_ROOT_ELEMENT_START,
    NULL_ELEMENT_NAME,
    NULL_ATTRIBUTE_NAME,
    STRAY_END_KEYWORD,
    ONLY_ONE_ROOT_ELEMENT_ALLOWED,
    NESTING_TOO_DEEP,

    INVALID_INDENT,

    ELEMENT_HAS_END_KEYWORD_NAME,
    ATTRIBUTE_HAS_END_KEYWORD_NAME,
    ATTRIBUTE_WITHOUT_VALUES
}
