package turnstile.core.util;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TimingSafeComparator")
class TimingSafeComparatorTest {

    @Nested
    @DisplayName("Byte arrays")
    class ByteArrayTests {

        @Test
        @DisplayName("should accept identical arrays")
        void shouldAcceptIdenticalArrays() {
            var a = "signature".getBytes(StandardCharsets.UTF_8);
            var b = "signature".getBytes(StandardCharsets.UTF_8);

            assertTrue(TimingSafeComparator.equals(a, b));
        }

        @Test
        @DisplayName("should reject a single flipped bit anywhere")
        void shouldRejectFlippedBit() {
            var original = "abcdef0123456789".getBytes(StandardCharsets.UTF_8);
            for (var i = 0; i < original.length; i++) {
                for (var bit = 0; bit < 8; bit++) {
                    var copy = original.clone();
                    copy[i] = (byte) (copy[i] ^ (1 << bit));
                    assertFalse(TimingSafeComparator.equals(original, copy), "byte " + i + " bit " + bit);
                }
            }
        }

        @Test
        @DisplayName("should reject arrays of different length")
        void shouldRejectDifferentLength() {
            assertFalse(TimingSafeComparator.equals(new byte[] {1, 2, 3}, new byte[] {1, 2}));
        }

        @Test
        @DisplayName("should reject null inputs")
        void shouldRejectNull() {
            assertFalse(TimingSafeComparator.equals((byte[]) null, new byte[0]));
            assertFalse(TimingSafeComparator.equals(new byte[0], (byte[]) null));
        }

        @Test
        @DisplayName("should accept two empty arrays")
        void shouldAcceptEmptyArrays() {
            assertTrue(TimingSafeComparator.equals(new byte[0], new byte[0]));
        }
    }

    @Nested
    @DisplayName("Strings")
    class StringTests {

        @Test
        @DisplayName("should compare UTF-8 content")
        void shouldCompareContent() {
            assertTrue(TimingSafeComparator.equals("sha256=abc", "sha256=abc"));
            assertFalse(TimingSafeComparator.equals("sha256=abc", "sha256=abd"));
            assertFalse(TimingSafeComparator.equals("abc", "ABC"));
        }

        @Test
        @DisplayName("should reject null strings")
        void shouldRejectNullStrings() {
            assertFalse(TimingSafeComparator.equals((String) null, "x"));
            assertFalse(TimingSafeComparator.equals("x", (String) null));
        }
    }
}
