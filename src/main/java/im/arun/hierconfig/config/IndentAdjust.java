package im.arun.hierconfig.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Pair of expressions bracketing a block that is nested one level deeper than its
 * whitespace shows, e.g. {@code template peer-policy} ... {@code exit-peer-policy}.
 */
public final class IndentAdjust {
    private final Pattern startExpression;
    private final Pattern endExpression;

    @JsonCreator
    public IndentAdjust(@JsonProperty("start_expression") String startExpression,
                        @JsonProperty("end_expression") String endExpression) {
        this.startExpression = Pattern.compile(Objects.requireNonNull(startExpression, "start_expression"));
        this.endExpression = Pattern.compile(Objects.requireNonNull(endExpression, "end_expression"));
    }

    public boolean startsBlock(String line) {
        return startExpression.matcher(line).find();
    }

    public Pattern getEndPattern() {
        return endExpression;
    }

    @JsonProperty("start_expression")
    public String getStartExpression() {
        return startExpression.pattern();
    }

    @JsonProperty("end_expression")
    public String getEndExpression() {
        return endExpression.pattern();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndentAdjust)) return false;
        IndentAdjust that = (IndentAdjust) o;
        return getStartExpression().equals(that.getStartExpression())
            && getEndExpression().equals(that.getEndExpression());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getStartExpression(), getEndExpression());
    }
}
