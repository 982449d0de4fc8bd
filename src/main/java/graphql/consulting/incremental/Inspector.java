package graphql.consulting.incremental;

import graphql.Internal;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;

import java.util.Iterator;
import java.util.Map;

/**
 * Renders values for error messages without leaking the internals of arbitrary objects.
 */
@Internal
public final class Inspector {

    private Inspector() {
    }

    public static String inspect(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return "\"" + value + "\"";
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Enum) {
            return String.valueOf(value);
        }
        if (value instanceof Map) {
            StringBuilder sb = new StringBuilder("{");
            Iterator<? extends Map.Entry<?, ?>> iterator = ((Map<?, ?>) value).entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<?, ?> entry = iterator.next();
                sb.append(entry.getKey()).append(": ").append(inspect(entry.getValue()));
                if (iterator.hasNext()) {
                    sb.append(", ");
                }
            }
            return sb.append("}").toString();
        }
        if (value instanceof Iterable) {
            StringBuilder sb = new StringBuilder("[");
            Iterator<?> iterator = ((Iterable<?>) value).iterator();
            while (iterator.hasNext()) {
                sb.append(inspect(iterator.next()));
                if (iterator.hasNext()) {
                    sb.append(", ");
                }
            }
            return sb.append("]").toString();
        }
        if (value instanceof GraphQLType) {
            return GraphQLTypeUtil.simplePrint((GraphQLType) value);
        }
        if (value instanceof Throwable) {
            return "<exception " + value.getClass().getSimpleName() + ">";
        }
        String name = value.getClass().getSimpleName();
        if (name.isEmpty()) {
            return "<object>";
        }
        return "<" + name + " instance>";
    }
}
