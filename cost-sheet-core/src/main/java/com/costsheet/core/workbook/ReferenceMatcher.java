package com.costsheet.core.workbook;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Matches references typed on a sheet against known item references.
 *
 * <p>Both sides are normalized (case, punctuation and whitespace removed) and compared in
 * this order:
 * <ol>
 *   <li>equal normalized references</li>
 *   <li>equal cores, the core being the text before the first space or bracket, so
 *       {@code "C1 (rev)"} and {@code "C1"} match</li>
 *   <li>a known reference that is a prefix of the sheet's; the longest wins</li>
 *   <li>a sheet reference that is a prefix of exactly one known reference</li>
 * </ol>
 * Suffixes a user appended on either side therefore still match, while {@code "C1"} never
 * picks {@code "C10"} over {@code "C1"}.
 */
final class ReferenceMatcher {

    private static final Pattern CORE_END = Pattern.compile("[\\s(\\[]");

    private ReferenceMatcher() {
    }

    static String normalize(String reference) {
        if (reference == null) {
            return "";
        }
        return reference.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
    }

    static String core(String reference) {
        if (reference == null) {
            return "";
        }
        String trimmed = reference.trim();
        String[] parts = CORE_END.split(trimmed, 2);
        return normalize(parts.length == 0 ? trimmed : parts[0]);
    }

    /**
     * Whether two references name the same item.
     */
    static boolean sameItem(String sheetReference, String knownReference) {
        return match(sheetReference, List.of(knownReference == null ? "" : knownReference)).isPresent();
    }

    static Optional<String> match(String sheetReference, Collection<String> knownReferences) {
        String target = normalize(sheetReference);
        if (target.isEmpty()) {
            return Optional.empty();
        }
        for (String known : knownReferences) {
            if (target.equals(normalize(known))) {
                return Optional.of(known);
            }
        }

        String targetCore = core(sheetReference);
        if (!targetCore.isEmpty()) {
            for (String known : knownReferences) {
                if (targetCore.equals(core(known))) {
                    return Optional.of(known);
                }
            }
        }

        String best = null;
        int bestLength = 0;
        for (String known : knownReferences) {
            String normalized = normalize(known);
            if (!normalized.isEmpty() && target.startsWith(normalized) && normalized.length() > bestLength) {
                best = known;
                bestLength = normalized.length();
            }
        }
        if (best != null) {
            return Optional.of(best);
        }

        List<String> extended = new ArrayList<>();
        for (String known : knownReferences) {
            if (normalize(known).startsWith(target)) {
                extended.add(known);
            }
        }
        return extended.size() == 1 ? Optional.of(extended.get(0)) : Optional.empty();
    }
}
