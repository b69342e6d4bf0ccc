package com.costsheet.core.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Estimator initials as printed on the cost sheet, e.g. {@code "Yazan Hunjul / Joe Salloum"}
 * becomes {@code "YH/JS"}.
 */
public final class Initials {

    private Initials() {
    }

    /**
     * Initials of one or more names separated by {@code /}.
     *
     * @param names names, may be null
     * @return initials, or null when there are no names
     */
    public static String of(String names) {
        if (names == null || names.isBlank()) {
            return null;
        }
        return Arrays.stream(names.split("/"))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .map(Initials::single)
            .collect(Collectors.joining("/"));
    }

    private static String single(String name) {
        return Arrays.stream(name.split("\\s+"))
            .filter(part -> !part.isEmpty())
            .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT))
            .collect(Collectors.joining());
    }
}
