package win.ixuni.buckets.core.util;

import win.ixuni.buckets.core.exception.InvalidArgumentException;

import java.util.Map;

/**
 * Request header validation
 * <p>
 * Only checks what would corrupt the HTTP request locally; naming and size rules are left to the
 * service.
 */
public class HeaderValidation {

    private static final String TOKEN_SPECIALS = "!#$%&'*+-.^_`|~";

    /**
     * Verify header names and values
     *
     * @param headers headers to check
     * @throws InvalidArgumentException on the first unsafe entry
     */
    public static void validate(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            String name = entry.getKey();
            if (!isToken(name)) {
                throw new InvalidArgumentException("Invalid header name: '" + name + "'");
            }
            if (entry.getValue() == null) {
                throw new InvalidArgumentException("Header '" + name + "' has no value");
            }
            if (!isFieldValue(entry.getValue())) {
                throw new InvalidArgumentException("Header '" + name + "' contains control characters");
            }
        }
    }

    /**
     * RFC 7230 token: visible ASCII minus separators
     */
    public static boolean isToken(String str) {
        if (str == null || str.isEmpty()) {
            return false;
        }
        for (char c : str.toCharArray()) {
            boolean ok = (c >= 'a' && c <= 'z')
                    || (c >= 'A' && c <= 'Z')
                    || (c >= '0' && c <= '9')
                    || TOKEN_SPECIALS.indexOf(c) >= 0;
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    /**
     * Field value without CR, LF or other control characters (tab allowed)
     */
    public static boolean isFieldValue(String str) {
        for (char c : str.toCharArray()) {
            if ((c < 0x20 && c != '\t') || c == 0x7f) {
                return false;
            }
        }
        return true;
    }
}
