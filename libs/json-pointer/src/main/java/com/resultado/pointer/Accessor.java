package com.resultado.pointer;

import java.io.Serializable;
import java.util.function.Function;

/**
 * Serializable property reader, written as a method reference such as {@code Order::lines}.
 *
 * <p>Being serializable lets {@link PointerPath} recover which method the reference names.
 *
 * @param <T> type that owns the property
 * @param <R> type of the property
 */
@FunctionalInterface
public interface Accessor<T, R> extends Function<T, R>, Serializable {}
