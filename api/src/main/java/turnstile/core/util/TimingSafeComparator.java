package turnstile.core.util;

import java.nio.charset.StandardCharsets;

/**
 * Constant-time equality for secrets and signatures.
 *
 * <p>Running time depends only on the input lengths, never on the position of
 * the first differing byte. Inputs of different lengths return {@code false}
 * immediately since lengths are not secret.
 */
public final class TimingSafeComparator {

    private TimingSafeComparator() {}

    /**
     * Compare two byte arrays in constant time.
     *
     * @param a the first array (may be null)
     * @param b the second array (may be null)
     * @return true if both are non-null and hold the same bytes
     */
    public static boolean equals(byte[] a, byte[] b) {
        if (a == null || b == null || a.length != b.length) {
            return false;
        }
        var diff = 0;
        for (var i = 0; i < a.length; i++) {
            diff |= a[i] ^ b[i];
        }
        return diff == 0;
    }

    /**
     * Compare two strings in constant time over their UTF-8 bytes.
     *
     * @param a the first string (may be null)
     * @param b the second string (may be null)
     * @return true if both are non-null and equal
     */
    public static boolean equals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return equals(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
