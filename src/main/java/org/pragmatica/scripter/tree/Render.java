package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

final class Render {
    private Render() {}

    /**
     * Prefix words followed by the given words, separated by single spaces.
     */
    static String words(List<String> prefix, String... words) {
        var all = new ArrayList<>(prefix);
        all.addAll(List.of(words));
        return String.join(" ", all);
    }

    static String join(Collection<?> items, String separator) {
        return items.stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(separator));
    }

    /**
     * {@code <A, B>} or the empty string when there are no arguments.
     */
    static String angled(List<?> arguments) {
        return arguments.isEmpty() ? "" : "<" + join(arguments, ", ") + ">";
    }

    static List<String> decorated(List<? extends Expression> decorators) {
        var result = new ArrayList<String>(decorators.size());
        for (var decorator : decorators) {
            result.add("@" + decorator);
        }
        return result;
    }
}
