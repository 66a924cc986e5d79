package com.resultado.pointer;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriUtils;

/**
 * Renders {@link PointerPath}s and {@link PathExpression}s as RFC 6901 JSON Pointers.
 *
 * <p>Segment names are the property names the given {@link ObjectMapper} writes, as its bean
 * introspection reports them. Without a mapper, a default {@code ObjectMapper} decides.
 *
 * <p>When an index value is unknown the whole pointer collapses to the single segment {@value
 * #INVALID_SEGMENT} instead of failing, so a pointer attached to an error report never hides the
 * report itself.
 */
public final class JsonPointers {

    private static final Logger log = LoggerFactory.getLogger(JsonPointers.class);

    /** Segment written for an index that could not be determined. */
    public static final String INVALID_SEGMENT = "INVALID_EXPRESSION";

    private static final ObjectMapper PLAIN = new ObjectMapper();

    private JsonPointers() {
        // utility class
    }

    /** Pointer in string form, {@code "/"} for the root itself. */
    public static String pointer(PointerPath<?, ?> path) {
        return pointer(path, (ObjectMapper) null);
    }

    /** Pointer in string form using {@code mapper}'s naming, {@code "/"} for the root itself. */
    public static String pointer(PointerPath<?, ?> path, ObjectMapper mapper) {
        Objects.requireNonNull(path, "path must not be null");
        return pointer(path.expression(), mapper);
    }

    /** Pointer in string form, {@code "/"} for the root itself. */
    public static String pointer(PathExpression expression, ObjectMapper mapper) {
        return "/" + String.join("/", segments(expression, mapper));
    }

    /** Pointer in URI fragment form, e.g. {@code "#/lines/0"}. */
    public static String uriPointer(PointerPath<?, ?> path) {
        return pointer(path, JsonPointerRepresentation.URI_FRAGMENT, null);
    }

    /** Pointer in URI fragment form using {@code mapper}'s naming. */
    public static String uriPointer(PointerPath<?, ?> path, ObjectMapper mapper) {
        return pointer(path, JsonPointerRepresentation.URI_FRAGMENT, mapper);
    }

    public static String pointer(PointerPath<?, ?> path, JsonPointerRepresentation representation) {
        return pointer(path, representation, null);
    }

    public static String pointer(
            PointerPath<?, ?> path, JsonPointerRepresentation representation, ObjectMapper mapper) {
        Objects.requireNonNull(path, "path must not be null");
        return pointer(path.expression(), representation, mapper);
    }

    /**
     * Pointer in the requested representation.
     *
     * <p>{@link JsonPointerRepresentation#JSON_STRING} gives {@code ""} for the root and {@code
     * "/a/b"} otherwise. {@link JsonPointerRepresentation#URI_FRAGMENT} gives {@code "#"} for the
     * root and {@code "#/a/b"} otherwise, with every segment percent-encoded.
     *
     * @throws UnsupportedOperationException for {@link JsonPointerRepresentation#NORMAL}
     * @throws UnsupportedPathException if the expression contains a node with no pointer form
     */
    public static String pointer(
            PathExpression expression, JsonPointerRepresentation representation, ObjectMapper mapper) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(representation, "representation must not be null");
        return switch (representation) {
            case JSON_STRING -> jsonString(segments(expression, mapper));
            case URI_FRAGMENT -> uriFragment(segments(expression, mapper));
            case NORMAL -> throw new UnsupportedOperationException(
                    "Representation " + representation + " is not supported");
        };
    }

    private static String jsonString(Deque<String> segments) {
        return segments.isEmpty() ? "" : "/" + String.join("/", segments);
    }

    private static String uriFragment(Deque<String> segments) {
        StringBuilder fragment = new StringBuilder("#");
        for (String segment : segments) {
            fragment.append('/').append(UriUtils.encode(segment, StandardCharsets.UTF_8));
        }
        return fragment.toString();
    }

    /** Walks from the leaf to the root, pushing segments so they come out root first. */
    static Deque<String> segments(PathExpression expression, ObjectMapper mapper) {
        Objects.requireNonNull(expression, "expression must not be null");
        ObjectMapper naming = mapper == null ? PLAIN : mapper;
        Deque<String> segments = new ArrayDeque<>();
        PathExpression node = expression;
        while (!(node instanceof PathExpression.Root)) {
            if (node instanceof PathExpression.FieldAccess access) {
                segments.push(serializedName(access, naming));
                node = access.target();
            } else if (node instanceof PathExpression.IndexAccess index) {
                String segment = indexSegment(index);
                if (segment == null) {
                    log.debug("Index of {} could not be determined, writing {}", index, INVALID_SEGMENT);
                    return new ArrayDeque<>(List.of(INVALID_SEGMENT));
                }
                segments.push(segment);
                node = index.target();
            } else if (node instanceof PathExpression.Widening widening) {
                node = widening.operand();
            } else {
                throw new UnsupportedPathException(node);
            }
        }
        return segments;
    }

    /** Index as a segment, or null when it is unknown. */
    private static String indexSegment(PathExpression.IndexAccess access) {
        Object index = access.index();
        if (index == null) {
            return null;
        }
        if (access.style() == PathExpression.IndexAccess.Style.INDEXER && !(index instanceof Integer)) {
            throw new UnsupportedPathException(access);
        }
        return index.toString();
    }

    /**
     * Name the mapper writes for the member, found through Jackson's own property introspection
     * so that naming strategies, {@code @JsonNaming}, {@code @JsonProperty} and mixins all apply.
     * Falls back to the member name when the mapper exposes no such property.
     */
    static String serializedName(PathExpression.FieldAccess access, ObjectMapper mapper) {
        SerializationConfig config = mapper.getSerializationConfig();
        BeanDescription description = config.introspect(mapper.constructType(access.owner()));
        List<BeanPropertyDefinition> properties = description.findProperties();
        String member = access.member();
        for (BeanPropertyDefinition property : properties) {
            if (readsMember(property, member)) {
                return property.getName();
            }
        }
        for (BeanPropertyDefinition property : properties) {
            if (member.equals(property.getInternalName())) {
                return property.getName();
            }
        }
        log.debug(
                "{} has no serialized property for {}, using the member name",
                access.owner().getName(),
                member);
        return member;
    }

    private static boolean readsMember(BeanPropertyDefinition property, String member) {
        return (property.hasGetter() && member.equals(property.getGetter().getName()))
                || (property.hasField() && member.equals(property.getField().getName()));
    }
}
