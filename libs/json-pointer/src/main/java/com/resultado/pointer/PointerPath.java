package com.resultado.pointer;

import java.util.List;
import java.util.Objects;

/**
 * Statically typed path from a root type {@code T} to a member of type {@code R}.
 *
 * <pre>{@code
 * PointerPath<Order, String> path = PointerPath.of(Order.class)
 *         .thenElement(Order::lines, 0)
 *         .then(OrderLine::sku);
 *
 * JsonPointers.pointer(path);      // "/lines/0/sku"
 * JsonPointers.uriPointer(path);   // "#/lines/0/sku"
 * }</pre>
 *
 * <p>Instances are immutable; every step returns a new path.
 *
 * @param <T> root type
 * @param <R> type the path ends in
 */
public final class PointerPath<T, R> {

    private final Class<T> rootType;
    private final PathExpression expression;

    private PointerPath(Class<T> rootType, PathExpression expression) {
        this.rootType = rootType;
        this.expression = expression;
    }

    /** Empty path standing for the whole {@code rootType} document. */
    public static <T> PointerPath<T, T> of(Class<T> rootType) {
        Objects.requireNonNull(rootType, "rootType must not be null");
        return new PointerPath<>(rootType, new PathExpression.Root(rootType));
    }

    /** Reads a property, e.g. {@code then(Order::customer)}. */
    public <N> PointerPath<T, N> then(Accessor<? super R, N> accessor) {
        Objects.requireNonNull(accessor, "accessor must not be null");
        return new PointerPath<>(rootType, AccessorIntrospector.read(expression, accessor));
    }

    /** Reads an array property and takes its element at {@code index}. */
    public <E> PointerPath<T, E> thenElement(Accessor<? super R, E[]> accessor, int index) {
        Objects.requireNonNull(accessor, "accessor must not be null");
        PathExpression array = AccessorIntrospector.read(expression, accessor);
        return new PointerPath<>(
                rootType,
                new PathExpression.IndexAccess(array, index, PathExpression.IndexAccess.Style.ARRAY));
    }

    /**
     * Reads a primitive array property, such as {@code int[]}, and takes its element at {@code
     * index}. The element is boxed, so the path ends in the box type viewed as {@code Object}.
     *
     * @throws IllegalArgumentException if the accessor does not return a primitive array
     */
    public PointerPath<T, Object> thenPrimitiveElement(Accessor<? super R, ?> accessor, int index) {
        Objects.requireNonNull(accessor, "accessor must not be null");
        Class<?> box = AccessorIntrospector.primitiveElementBox(accessor);
        PathExpression array = AccessorIntrospector.read(expression, accessor);
        PathExpression element =
                new PathExpression.IndexAccess(array, index, PathExpression.IndexAccess.Style.ARRAY);
        return new PointerPath<>(rootType, new PathExpression.Widening(element, box));
    }

    /** Reads a list property and takes its item at {@code index} through {@link List#get(int)}. */
    public <E> PointerPath<T, E> thenItem(Accessor<? super R, ? extends List<E>> accessor, int index) {
        Objects.requireNonNull(accessor, "accessor must not be null");
        PathExpression list = AccessorIntrospector.read(expression, accessor);
        return new PointerPath<>(
                rootType,
                new PathExpression.IndexAccess(list, index, PathExpression.IndexAccess.Style.INDEXER));
    }

    /**
     * Views the path as ending in {@code Object}, so paths to members of different types can be
     * collected together. Adds no pointer segment.
     */
    public PointerPath<T, Object> widen() {
        return new PointerPath<>(rootType, new PathExpression.Widening(expression, Object.class));
    }

    public Class<T> rootType() {
        return rootType;
    }

    /** The expression tree, leaf first. */
    public PathExpression expression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PointerPath<?, ?> other)) {
            return false;
        }
        return rootType.equals(other.rootType) && expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootType, expression);
    }

    @Override
    public String toString() {
        return expression.toString();
    }
}
