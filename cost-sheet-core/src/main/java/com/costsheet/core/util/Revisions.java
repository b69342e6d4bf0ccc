package com.costsheet.core.util;

/**
 * Revision letter arithmetic.
 *
 * <p>Revisions run {@code A..Z}, then {@code AA, AB, ...} like spreadsheet column names.
 * An empty revision means the project has not been revised yet.
 */
public final class Revisions {

    private Revisions() {
    }

    /**
     * Next revision after the given one.
     *
     * @param revision current revision, null or empty before the first revision
     * @return next revision
     * @throws IllegalArgumentException if the revision contains anything but letters
     */
    public static String next(String revision) {
        if (revision == null || revision.isBlank()) {
            return "A";
        }
        String current = revision.trim().toUpperCase();
        if (!current.chars().allMatch(c -> c >= 'A' && c <= 'Z')) {
            throw new IllegalArgumentException("Invalid revision: " + revision);
        }
        char[] letters = current.toCharArray();
        int i = letters.length - 1;
        while (i >= 0) {
            if (letters[i] != 'Z') {
                letters[i]++;
                return new String(letters);
            }
            letters[i] = 'A';
            i--;
        }
        return "A" + new String(letters);
    }
}
