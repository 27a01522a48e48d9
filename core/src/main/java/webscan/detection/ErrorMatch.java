package webscan.detection;

import webscan.payload.DatabaseDialect;

/**
 * Database error message located in a response body.
 *
 * @param dialect database the error pattern belongs to
 * @param pattern regular expression that matched
 * @param matchedText the matched text itself
 * @param excerpt surrounding text, up to 50 characters on each side
 */
public record ErrorMatch(DatabaseDialect dialect, String pattern, String matchedText, String excerpt) {
}
