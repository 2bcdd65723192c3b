package turnstile.core.service.common;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import turnstile.core.config.TrustedProxyConfig;
import turnstile.core.util.IpAddresses;

/**
 * Validates whether a direct connection address belongs to a trusted proxy.
 *
 * <p>Proxy entries are parsed once at construction. Entries that fail to parse
 * are logged and skipped, so a typo never widens trust.
 */
@ApplicationScoped
public class TrustedProxyValidator {

    private static final Logger LOG = Logger.getLogger(TrustedProxyValidator.class);

    private final boolean enabled;
    private final List<ProxyRange> ranges;

    private record ProxyRange(byte[] network, int prefixLength) {

        boolean contains(byte[] address) {
            if (address.length != network.length) {
                return false;
            }
            final var fullBytes = prefixLength / 8;
            for (var i = 0; i < fullBytes; i++) {
                if (address[i] != network[i]) {
                    return false;
                }
            }
            final var remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            final var mask = 0xFF << (8 - remainingBits);
            return (address[fullBytes] & mask) == (network[fullBytes] & mask);
        }
    }

    @Inject
    public TrustedProxyValidator(TrustedProxyConfig config) {
        this.enabled = config.enabled();
        this.ranges = parseRanges(config.proxies().orElse(List.of()));
        if (enabled && ranges.isEmpty()) {
            LOG.warn("Trusted proxy validation is enabled but no valid proxies are configured; "
                    + "forwarding headers will be ignored");
        }
    }

    /**
     * Check if forwarding headers should be trusted for the given direct address.
     *
     * @param socketIp the direct connection's address (may be null)
     * @return true if forwarding headers should be trusted
     */
    public boolean shouldTrustForwardingHeaders(String socketIp) {
        if (!enabled) {
            return true;
        }
        if (socketIp == null || socketIp.isBlank()) {
            return false;
        }
        final var address = IpAddresses.parseLiteral(socketIp.trim());
        if (address.isEmpty()) {
            return false;
        }
        final var bytes = address.get().getAddress();
        return ranges.stream().anyMatch(range -> range.contains(bytes));
    }

    private static List<ProxyRange> parseRanges(List<String> entries) {
        final var parsed = new ArrayList<ProxyRange>();
        for (final var entry : entries) {
            parseRange(entry.trim())
                    .ifPresentOrElse(parsed::add, () -> LOG.warnf("Ignoring invalid trusted proxy: %s", entry));
        }
        return List.copyOf(parsed);
    }

    private static Optional<ProxyRange> parseRange(String entry) {
        final var slash = entry.indexOf('/');
        final var addressPart = slash >= 0 ? entry.substring(0, slash) : entry;
        final var address = IpAddresses.parseLiteral(addressPart);
        if (address.isEmpty()) {
            return Optional.empty();
        }
        final var bytes = address.get().getAddress();
        final var maxPrefix = bytes.length * 8;
        if (slash < 0) {
            return Optional.of(new ProxyRange(bytes, maxPrefix));
        }
        try {
            final var prefix = Integer.parseInt(entry.substring(slash + 1));
            if (prefix < 0 || prefix > maxPrefix) {
                return Optional.empty();
            }
            return Optional.of(new ProxyRange(bytes, prefix));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
