/**
 * JSON Pointers (RFC 6901) derived from typed member paths.
 *
 * <p>Build a {@link com.resultado.pointer.PointerPath} from method references and hand it to
 * {@link com.resultado.pointer.JsonPointers} to get the pointer a Jackson-serialized document
 * would need to reach that member.
 */
package com.resultado.pointer;
