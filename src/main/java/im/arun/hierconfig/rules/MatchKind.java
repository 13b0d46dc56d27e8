package im.arun.hierconfig.rules;

import java.util.Locale;

/**
 * Text comparison applied by one level of a lineage rule.
 */
public enum MatchKind {
    EQUALS("equals"),
    STARTSWITH("startswith"),
    ENDSWITH("endswith"),
    CONTAINS("contains"),
    RE_SEARCH("re_search");

    private final String key;

    MatchKind(String key) {
        this.key = key;
    }

    /** YAML key naming this kind. */
    public String getKey() {
        return key;
    }

    /**
     * Resolve a YAML key, or return null when the key names no kind.
     * {@code regex} is accepted as an alias of {@code re_search}.
     */
    public static MatchKind fromKey(String key) {
        String normalized = key.toLowerCase(Locale.ROOT);
        if ("regex".equals(normalized)) {
            return RE_SEARCH;
        }
        for (MatchKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
