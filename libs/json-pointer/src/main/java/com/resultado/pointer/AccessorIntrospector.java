package com.resultado.pointer;

import java.lang.invoke.MethodHandleInfo;
import java.lang.invoke.SerializedLambda;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.Map;

/** Turns an {@link Accessor} method reference into the expression node it stands for. */
final class AccessorIntrospector {

    private static final Map<Character, Class<?>> BOXES =
            Map.of(
                    'Z', Boolean.class,
                    'B', Byte.class,
                    'C', Character.class,
                    'S', Short.class,
                    'I', Integer.class,
                    'J', Long.class,
                    'F', Float.class,
                    'D', Double.class);

    private AccessorIntrospector() {
        // utility class
    }

    /**
     * Builds the node for reading {@code accessor} on {@code target}.
     *
     * <p>Record accessors and bean getters become a {@link PathExpression.FieldAccess} naming the
     * method, wrapped in a {@link PathExpression.Widening} when the accessor returns a primitive.
     * Lambdas and any other method become a {@link PathExpression.Invocation}.
     *
     * @throws IllegalArgumentException if the accessor is not a serializable lambda
     */
    static PathExpression read(PathExpression target, Accessor<?, ?> accessor) {
        SerializedLambda lambda = serializedLambda(accessor);
        String methodName = lambda.getImplMethodName();
        String signature = lambda.getImplMethodSignature();

        if (methodName.startsWith("lambda$")
                || !isInstanceCall(lambda.getImplMethodKind())
                || !signature.startsWith("()")) {
            return new PathExpression.Invocation(target, methodName);
        }

        Class<?> owner = load(lambda.getImplClass(), accessor.getClass().getClassLoader());
        if (!isPropertyAccessor(owner, methodName, signature)) {
            return new PathExpression.Invocation(target, methodName);
        }

        PathExpression access = new PathExpression.FieldAccess(target, owner, methodName);
        Class<?> box = BOXES.get(signature.charAt(2));
        return box == null ? access : new PathExpression.Widening(access, box);
    }

    /**
     * Box type of the elements of the primitive array {@code accessor} returns, e.g. {@code
     * Integer} for {@code int[]}.
     *
     * @throws IllegalArgumentException if the accessor does not name a method returning a
     *     one-dimensional primitive array
     */
    static Class<?> primitiveElementBox(Accessor<?, ?> accessor) {
        String signature = serializedLambda(accessor).getImplMethodSignature();
        String returned = signature.substring(signature.indexOf(')') + 1);
        Class<?> box =
                returned.length() == 2 && returned.charAt(0) == '['
                        ? BOXES.get(returned.charAt(1))
                        : null;
        if (box == null) {
            throw new IllegalArgumentException(
                    "Accessor must return a primitive array, but returns " + returned);
        }
        return box;
    }

    private static boolean isInstanceCall(int kind) {
        return kind == MethodHandleInfo.REF_invokeVirtual
                || kind == MethodHandleInfo.REF_invokeInterface;
    }

    /** True for a record component accessor or a {@code get}/{@code is} bean getter. */
    private static boolean isPropertyAccessor(Class<?> owner, String methodName, String signature) {
        if (owner.isRecord()) {
            for (RecordComponent component : owner.getRecordComponents()) {
                if (component.getName().equals(methodName)) {
                    return true;
                }
            }
        }
        if (methodName.startsWith("get") && methodName.length() > 3) {
            return !signature.endsWith(")V");
        }
        return methodName.startsWith("is")
                && methodName.length() > 2
                && (signature.endsWith(")Z") || signature.endsWith(")Ljava/lang/Boolean;"));
    }

    private static SerializedLambda serializedLambda(Accessor<?, ?> accessor) {
        try {
            Method writeReplace = accessor.getClass().getDeclaredMethod("writeReplace");
            writeReplace.setAccessible(true);
            return (SerializedLambda) writeReplace.invoke(accessor);
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new IllegalArgumentException(
                    "Accessor must be a method reference or lambda: " + accessor, e);
        }
    }

    private static Class<?> load(String internalName, ClassLoader loader) {
        try {
            return Class.forName(internalName.replace('/', '.'), false, loader);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Cannot load accessor owner " + internalName, e);
        }
    }
}
