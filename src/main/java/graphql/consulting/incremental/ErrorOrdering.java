package graphql.consulting.incremental;

import graphql.GraphQLError;
import graphql.Internal;
import graphql.language.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Orders errors by locations, then path, then message so that results do not depend on the
 * order in which concurrently resolved fields failed.
 */
@Internal
public final class ErrorOrdering implements Comparator<GraphQLError> {

    public static final ErrorOrdering INSTANCE = new ErrorOrdering();

    private ErrorOrdering() {
    }

    public static List<GraphQLError> sorted(List<GraphQLError> errors) {
        List<GraphQLError> result = new ArrayList<>(errors);
        result.sort(INSTANCE);
        return result;
    }

    @Override
    public int compare(GraphQLError e1, GraphQLError e2) {
        int result = compareLocations(nullToEmpty(e1.getLocations()), nullToEmpty(e2.getLocations()));
        if (result != 0) {
            return result;
        }
        result = comparePaths(nullToEmpty(e1.getPath()), nullToEmpty(e2.getPath()));
        if (result != 0) {
            return result;
        }
        return String.valueOf(e1.getMessage()).compareTo(String.valueOf(e2.getMessage()));
    }

    private static int compareLocations(List<SourceLocation> l1, List<SourceLocation> l2) {
        int size = Math.min(l1.size(), l2.size());
        for (int i = 0; i < size; i++) {
            SourceLocation s1 = l1.get(i);
            SourceLocation s2 = l2.get(i);
            int result = Integer.compare(s1.getLine(), s2.getLine());
            if (result == 0) {
                result = Integer.compare(s1.getColumn(), s2.getColumn());
            }
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(l1.size(), l2.size());
    }

    private static int comparePaths(List<Object> p1, List<Object> p2) {
        int size = Math.min(p1.size(), p2.size());
        for (int i = 0; i < size; i++) {
            Object s1 = p1.get(i);
            Object s2 = p2.get(i);
            int result;
            if (s1 instanceof Integer && s2 instanceof Integer) {
                result = Integer.compare((Integer) s1, (Integer) s2);
            } else {
                result = String.valueOf(s1).compareTo(String.valueOf(s2));
            }
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(p1.size(), p2.size());
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? Collections.<T>emptyList() : list;
    }
}
