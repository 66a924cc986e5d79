package com.resultado.pointer;

import java.util.Objects;

/**
 * Typed access expression from a root type down to one of its members.
 *
 * <p>Each node points back towards the root, the way a compiled access expression is shaped:
 * {@code t.nested.items[0]} is an {@link IndexAccess} over a {@link FieldAccess} over a {@link
 * FieldAccess} over the {@link Root}. {@link PointerPath} builds these from method references;
 * they can also be assembled by hand.
 */
public sealed interface PathExpression
        permits PathExpression.Root,
                PathExpression.FieldAccess,
                PathExpression.IndexAccess,
                PathExpression.Widening,
                PathExpression.Invocation {

    /** Short name of the node shape, used in error messages. */
    default String nodeKind() {
        return getClass().getSimpleName();
    }

    /** The root parameter of the expression. */
    record Root(Class<?> type) implements PathExpression {
        public Root {
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public String toString() {
            return type.getSimpleName();
        }
    }

    /**
     * Read of a property of {@code target}.
     *
     * @param target the object being read
     * @param owner class declaring the property; introspected for its serialized name
     * @param member the Java member that is read: a record component, getter or field name, e.g.
     *     {@code nested} or {@code getDisplayName}
     */
    record FieldAccess(PathExpression target, Class<?> owner, String member)
            implements PathExpression {
        public FieldAccess {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(owner, "owner must not be null");
            Objects.requireNonNull(member, "member must not be null");
        }

        @Override
        public String toString() {
            return target + "." + member;
        }
    }

    /**
     * Element read with a literal index.
     *
     * @param target the array or list being indexed
     * @param index the literal index; {@code null} when it could not be determined
     * @param style array subscript or list indexer call
     */
    record IndexAccess(PathExpression target, Object index, Style style)
            implements PathExpression {
        public IndexAccess {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(style, "style must not be null");
        }

        /** How the element is read. */
        public enum Style {
            /** {@code array[i]} */
            ARRAY,
            /** {@code list.get(i)} */
            INDEXER
        }

        @Override
        public String toString() {
            return style == Style.ARRAY ? target + "[" + index + "]" : target + ".get(" + index + ")";
        }
    }

    /**
     * Implicit boxing or numeric widening of {@code operand} to {@code type}. Contributes no
     * pointer segment.
     */
    record Widening(PathExpression operand, Class<?> type) implements PathExpression {
        public Widening {
            Objects.requireNonNull(operand, "operand must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public String toString() {
            return "(" + type.getSimpleName() + ") " + operand;
        }
    }

    /**
     * Call of something that is not a property accessor, such as a lambda body or {@code
     * toString()}. It cannot be turned into a pointer.
     */
    record Invocation(PathExpression target, String method) implements PathExpression {
        public Invocation {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(method, "method must not be null");
        }

        @Override
        public String toString() {
            return target + "." + method + "()";
        }
    }
}
