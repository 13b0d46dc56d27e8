package im.arun.hierconfig.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One level of a lineage rule, e.g. {@code {startswith: interface}} or
 * {@code {re_search: "^ip access-list", negate: true}}.
 * <p>
 * A list value matches when any of its entries matches. Regexes are compiled once here.
 */
public final class MatchSpec {
    private static final String NEGATE_KEY = "negate";

    private final MatchKind kind;
    private final List<String> values;
    private final List<Pattern> patterns;
    private final boolean negate;

    public MatchSpec(MatchKind kind, List<String> values, boolean negate) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Match specifier '" + kind.getKey() + "' needs at least one value");
        }
        this.values = List.copyOf(values);
        this.negate = negate;
        if (kind == MatchKind.RE_SEARCH) {
            List<Pattern> compiled = new ArrayList<>();
            for (String value : this.values) {
                compiled.add(Pattern.compile(value));
            }
            this.patterns = Collections.unmodifiableList(compiled);
        } else {
            this.patterns = List.of();
        }
    }

    public static MatchSpec of(MatchKind kind, String... values) {
        return new MatchSpec(kind, List.of(values), false);
    }

    public static MatchSpec not(MatchKind kind, String... values) {
        return new MatchSpec(kind, List.of(values), true);
    }

    public static MatchSpec equalTo(String... values) {
        return of(MatchKind.EQUALS, values);
    }

    public static MatchSpec startsWith(String... values) {
        return of(MatchKind.STARTSWITH, values);
    }

    public static MatchSpec endsWith(String... values) {
        return of(MatchKind.ENDSWITH, values);
    }

    public static MatchSpec contains(String... values) {
        return of(MatchKind.CONTAINS, values);
    }

    public static MatchSpec regex(String... values) {
        return of(MatchKind.RE_SEARCH, values);
    }

    /**
     * Build from the YAML map form. Exactly one kind key is allowed, plus an optional
     * {@code negate} flag.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MatchSpec fromMap(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("Empty lineage match specifier");
        }
        MatchKind kind = null;
        List<String> values = null;
        boolean negate = false;
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            if (NEGATE_KEY.equals(entry.getKey())) {
                negate = Boolean.parseBoolean(String.valueOf(entry.getValue()));
                continue;
            }
            MatchKind candidate = MatchKind.fromKey(entry.getKey());
            if (candidate == null) {
                throw new IllegalArgumentException("Unknown lineage match kind: " + entry.getKey());
            }
            if (kind != null) {
                throw new IllegalArgumentException("Lineage match specifier has more than one kind: " + raw.keySet());
            }
            kind = candidate;
            values = toStrings(entry.getValue());
        }
        if (kind == null) {
            throw new IllegalArgumentException("Lineage match specifier has no match kind: " + raw.keySet());
        }
        return new MatchSpec(kind, values, negate);
    }

    private static List<String> toStrings(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                result.add(String.valueOf(item));
            }
        } else if (value != null) {
            result.add(String.valueOf(value));
        }
        return result;
    }

    public boolean test(String text) {
        return testPositive(text) != negate;
    }

    private boolean testPositive(String text) {
        switch (kind) {
            case EQUALS:
                return values.contains(text);
            case STARTSWITH:
                for (String value : values) {
                    if (text.startsWith(value)) return true;
                }
                return false;
            case ENDSWITH:
                for (String value : values) {
                    if (text.endsWith(value)) return true;
                }
                return false;
            case CONTAINS:
                for (String value : values) {
                    if (text.contains(value)) return true;
                }
                return false;
            case RE_SEARCH:
                for (Pattern pattern : patterns) {
                    if (pattern.matcher(text).find()) return true;
                }
                return false;
            default:
                throw new IllegalStateException("Unhandled match kind " + kind);
        }
    }

    public MatchKind getKind() {
        return kind;
    }

    public List<String> getValues() {
        return values;
    }

    public boolean isNegate() {
        return negate;
    }

    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(kind.getKey(), values.size() == 1 ? values.get(0) : values);
        if (negate) {
            map.put(NEGATE_KEY, true);
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchSpec)) return false;
        MatchSpec that = (MatchSpec) o;
        return negate == that.negate && kind == that.kind && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, values, negate);
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
