package graphql.consulting.incremental.values;

import graphql.Internal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Internal
public final class Suggestions {

    private static final int MAX_SUGGESTIONS = 5;

    private Suggestions() {
    }

    /**
     * Given [A, B, C] returns " Did you mean 'A', 'B', or 'C'?", or an empty string when there is
     * nothing to suggest.
     */
    public static String didYouMean(List<String> suggestions) {
        if (suggestions.isEmpty()) {
            return "";
        }
        List<String> quoted = new ArrayList<>();
        for (String suggestion : suggestions.subList(0, Math.min(MAX_SUGGESTIONS, suggestions.size()))) {
            quoted.add("'" + suggestion + "'");
        }
        StringBuilder sb = new StringBuilder(" Did you mean ");
        if (quoted.size() == 1) {
            sb.append(quoted.get(0));
        } else if (quoted.size() == 2) {
            sb.append(quoted.get(0)).append(" or ").append(quoted.get(1));
        } else {
            sb.append(String.join(", ", quoted.subList(0, quoted.size() - 1)))
                    .append(", or ").append(quoted.get(quoted.size() - 1));
        }
        return sb.append("?").toString();
    }

    /**
     * The options close enough to the input, most similar first.
     */
    public static List<String> suggestionList(String input, Collection<String> options) {
        Map<String, Integer> optionsByDistance = new LinkedHashMap<>();
        int inputThreshold = input.length() / 2;
        for (String option : options) {
            int distance = lexicalDistance(input, option);
            int threshold = Math.max(Math.max(inputThreshold, option.length() / 2), 1);
            if (distance <= threshold) {
                optionsByDistance.put(option, distance);
            }
        }
        List<String> result = new ArrayList<>(optionsByDistance.keySet());
        result.sort(Comparator.comparing(optionsByDistance::get));
        return result;
    }

    /**
     * Edit distance counting insertions, deletions, substitutions and swaps of adjacent
     * characters. A pure case change counts as one edit.
     */
    static int lexicalDistance(String aStr, String bStr) {
        if (aStr.equals(bStr)) {
            return 0;
        }
        String a = aStr.toLowerCase(Locale.ROOT);
        String b = bStr.toLowerCase(Locale.ROOT);
        if (a.equals(b)) {
            return 1;
        }
        int aLen = a.length();
        int bLen = b.length();
        int[][] d = new int[aLen + 1][bLen + 1];
        for (int j = 0; j <= bLen; j++) {
            d[0][j] = j;
        }
        for (int i = 1; i <= aLen; i++) {
            d[i][0] = i;
        }
        for (int i = 1; i <= aLen; i++) {
            for (int j = 1; j <= bLen; j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                d[i][j] = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
                if (i > 1 && j > 1 && a.charAt(i - 1) == b.charAt(j - 2) && a.charAt(i - 2) == b.charAt(j - 1)) {
                    d[i][j] = Math.min(d[i][j], d[i - 2][j - 2] + cost);
                }
            }
        }
        return d[aLen][bLen];
    }
}
