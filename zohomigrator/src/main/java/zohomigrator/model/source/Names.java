package zohomigrator.model.source;

/**
 * Person-name helpers shared by the source records.
 */
final class Names {

    private Names() {}

    /** Joins first and last name with a space, skipping blanks. */
    static String join(String first, String last) {
        String f = first != null ? first.trim() : "";
        String l = last != null ? last.trim() : "";
        if (f.isEmpty()) return l;
        if (l.isEmpty()) return f;
        return f + " " + l;
    }
}
