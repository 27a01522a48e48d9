package webscan.detection;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Вид логического условия, которое несет boolean-based нагрузка.
 */
public enum BooleanCondition {
    /** {@code OR} with a true comparison, expected to widen the result set. */
    OR_TRUE,
    /** {@code AND} with a true comparison, expected to leave the page unchanged. */
    AND_TRUE,
    /** {@code AND} with a false comparison, expected to empty the result set. */
    AND_FALSE,
    UNKNOWN;

    private static final Pattern CONDITION = Pattern.compile(
        "\\b(OR|AND)\\s+'?(\\w+)'?\\s*=\\s*'?(\\w+)'?", Pattern.CASE_INSENSITIVE);

    public static BooleanCondition classify(String payload) {
        if (payload == null) {
            return UNKNOWN;
        }
        Matcher matcher = CONDITION.matcher(payload);
        if (!matcher.find()) {
            return UNKNOWN;
        }
        boolean isOr = matcher.group(1).equalsIgnoreCase("OR");
        boolean isTrue = matcher.group(2).equals(matcher.group(3));
        if (isOr) {
            return isTrue ? OR_TRUE : UNKNOWN;
        }
        return isTrue ? AND_TRUE : AND_FALSE;
    }

    /**
     * Turns a true comparison into a false one, {@code '1'='1} into {@code '1'='2}.
     *
     * @return the rewritten payload, or empty if the payload carries no true comparison
     */
    public static Optional<String> falseCounterpart(String payload) {
        if (payload == null) {
            return Optional.empty();
        }
        Matcher matcher = CONDITION.matcher(payload);
        if (!matcher.find() || !matcher.group(2).equals(matcher.group(3))) {
            return Optional.empty();
        }
        String right = matcher.group(3);
        String changed = right.chars().allMatch(Character::isDigit)
            ? String.valueOf(Long.parseLong(right) + 1)
            : right + "x";
        return Optional.of(payload.substring(0, matcher.start(3)) + changed + payload.substring(matcher.end(3)));
    }
}
