package com.resultado.pointer;

/** Textual forms of a JSON Pointer, as listed in RFC 6901. */
public enum JsonPointerRepresentation {

    /** RFC 6901 §3 with {@code ~0}/{@code ~1} escaping. Not supported. */
    NORMAL,

    /** RFC 6901 §5: {@code /a/0/b}, segments unescaped. */
    JSON_STRING,

    /** RFC 6901 §6: {@code #/a/0/b}, segments percent-encoded. */
    URI_FRAGMENT
}
