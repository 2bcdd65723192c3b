package turnstile.core.service.common;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import turnstile.core.config.TrustedProxyConfig;

@DisplayName("TrustedProxyValidator")
class TrustedProxyValidatorTest {

    @Nested
    @DisplayName("When disabled")
    class DisabledTests {

        @Test
        @DisplayName("should always trust forwarding headers")
        void shouldAlwaysTrust() {
            var validator = createValidator(false, null);

            assertTrue(validator.shouldTrustForwardingHeaders("1.2.3.4"));
            assertTrue(validator.shouldTrustForwardingHeaders(null));
        }
    }

    @Nested
    @DisplayName("When enabled")
    class EnabledTests {

        @Test
        @DisplayName("should reject missing socket IPs")
        void shouldRejectMissingSocketIp() {
            var validator = createValidator(true, List.of("10.0.0.0/8"));

            assertFalse(validator.shouldTrustForwardingHeaders(null));
            assertFalse(validator.shouldTrustForwardingHeaders(""));
        }

        @Test
        @DisplayName("should reject when no proxies are configured")
        void shouldRejectWithoutProxies() {
            assertFalse(createValidator(true, List.of()).shouldTrustForwardingHeaders("10.0.0.1"));
            assertFalse(createValidator(true, null).shouldTrustForwardingHeaders("10.0.0.1"));
        }

        @Test
        @DisplayName("should trust an exact IP match")
        void shouldTrustExactMatch() {
            var validator = createValidator(true, List.of("192.168.1.10"));

            assertTrue(validator.shouldTrustForwardingHeaders("192.168.1.10"));
            assertFalse(validator.shouldTrustForwardingHeaders("192.168.1.11"));
        }

        @Test
        @DisplayName("should trust addresses inside an IPv4 CIDR")
        void shouldTrustIpv4Cidr() {
            var validator = createValidator(true, List.of("10.0.0.0/8", "172.16.0.0/12"));

            assertTrue(validator.shouldTrustForwardingHeaders("10.255.1.2"));
            assertTrue(validator.shouldTrustForwardingHeaders("172.31.255.255"));
            assertFalse(validator.shouldTrustForwardingHeaders("172.32.0.1"));
            assertFalse(validator.shouldTrustForwardingHeaders("11.0.0.1"));
        }

        @Test
        @DisplayName("should trust addresses inside an IPv6 CIDR")
        void shouldTrustIpv6Cidr() {
            var validator = createValidator(true, List.of("fd00::/8"));

            assertTrue(validator.shouldTrustForwardingHeaders("fd12:3456::1"));
            assertFalse(validator.shouldTrustForwardingHeaders("2001:db8::1"));
            assertFalse(validator.shouldTrustForwardingHeaders("10.0.0.1"));
        }

        @Test
        @DisplayName("should skip invalid entries")
        void shouldSkipInvalidEntries() {
            var validator = createValidator(true, List.of("not-an-ip", "10.0.0.0/99", "10.0.0.0/8"));

            assertTrue(validator.shouldTrustForwardingHeaders("10.1.1.1"));
        }

        @Test
        @DisplayName("should not resolve host names")
        void shouldNotResolveHostNames() {
            var validator = createValidator(true, List.of("127.0.0.0/8"));

            assertFalse(validator.shouldTrustForwardingHeaders("localhost"));
        }
    }

    private static TrustedProxyValidator createValidator(boolean enabled, List<String> proxies) {
        var config = mock(TrustedProxyConfig.class);
        when(config.enabled()).thenReturn(enabled);
        when(config.proxies()).thenReturn(Optional.ofNullable(proxies));
        return new TrustedProxyValidator(config);
    }
}
