package io.regtruth.pipeline.fetch;

import java.util.HashMap;
import java.util.Map;

public final class ChangeSummarizer {

    private ChangeSummarizer() {
    }

    /**
     * Line-level summary such as {@code "+3 -1 lines"}. Lines are compared as a multiset, so
     * moved lines do not count.
     */
    public static String summarize(String previous, String current) {
        if (previous == null) {
            return "initial snapshot";
        }
        Map<String, Integer> remaining = new HashMap<>();
        for (String line : lines(previous)) {
            remaining.merge(line, 1, Integer::sum);
        }

        int added = 0;
        for (String line : lines(current)) {
            Integer count = remaining.get(line);
            if (count == null || count == 0) {
                added++;
            } else {
                remaining.put(line, count - 1);
            }
        }
        int removed = remaining.values().stream().mapToInt(Integer::intValue).sum();
        return "+" + added + " -" + removed + " lines";
    }

    private static String[] lines(String text) {
        if (text == null || text.isBlank()) {
            return new String[0];
        }
        return text.strip().split("\\r?\\n");
    }
}
