package webscan.payload;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Alternate encodings of payloads meant to slip past naive input filters (WAF bypass).
 *
 * <p>Only characters that break URLs or trip filters are percent-encoded; the characters
 * that carry SQL structure ({@code ' ( ) * =} and comment markers) are kept literal.
 */
public final class PayloadEncoder {

    private static final Map<Character, String> SPECIAL_CHARS = new LinkedHashMap<>();

    static {
        SPECIAL_CHARS.put(' ', "%20");
        SPECIAL_CHARS.put('#', "%23");
        SPECIAL_CHARS.put('&', "%26");
        SPECIAL_CHARS.put('+', "%2B");
        SPECIAL_CHARS.put(';', "%3B");
        SPECIAL_CHARS.put('<', "%3C");
        SPECIAL_CHARS.put('>', "%3E");
        SPECIAL_CHARS.put('"', "%22");
        SPECIAL_CHARS.put('{', "%7B");
        SPECIAL_CHARS.put('}', "%7D");
        SPECIAL_CHARS.put('|', "%7C");
        SPECIAL_CHARS.put('\\', "%5C");
        SPECIAL_CHARS.put('^', "%5E");
        SPECIAL_CHARS.put('~', "%7E");
        SPECIAL_CHARS.put('[', "%5B");
        SPECIAL_CHARS.put(']', "%5D");
        SPECIAL_CHARS.put('`', "%60");
    }

    private PayloadEncoder() {
    }

    /**
     * Percent-encodes filter-sensitive characters once.
     */
    public static String urlEncode(String payload) {
        return encode(payload, false);
    }

    /**
     * Percent-encodes filter-sensitive characters twice ({@code %} becomes {@code %25}),
     * so a filter that decodes once still sees an encoded string.
     */
    public static String doubleUrlEncode(String payload) {
        return encode(payload, true);
    }

    private static String encode(String payload, boolean doubleEncode) {
        StringBuilder sb = new StringBuilder(payload.length() * 2);
        for (char c : payload.toCharArray()) {
            String encoded = SPECIAL_CHARS.get(c);
            if (encoded == null) {
                sb.append(c);
            } else {
                sb.append(doubleEncode ? encoded.replace("%", "%25") : encoded);
            }
        }
        return sb.toString();
    }
}
