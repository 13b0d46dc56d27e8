package im.arun.hierconfig.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Regex rewrite ({@code search} to {@code replace}) applied to configuration text.
 * The pattern is compiled once; {@code replace} uses {@link java.util.regex.Matcher} syntax.
 */
public final class Substitution {
    private final String search;
    private final String replace;
    private final Pattern pattern;

    @JsonCreator
    public Substitution(@JsonProperty("search") String search,
                        @JsonProperty("replace") String replace) {
        this.search = Objects.requireNonNull(search, "search");
        this.replace = replace == null ? "" : replace;
        this.pattern = Pattern.compile(search);
    }

    public String apply(CharSequence text) {
        return pattern.matcher(text).replaceAll(replace);
    }

    @JsonProperty("search")
    public String getSearch() {
        return search;
    }

    @JsonProperty("replace")
    public String getReplace() {
        return replace;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Substitution)) return false;
        Substitution that = (Substitution) o;
        return search.equals(that.search) && replace.equals(that.replace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(search, replace);
    }

    @Override
    public String toString() {
        return "Substitution(" + search + " -> " + replace + ")";
    }
}
