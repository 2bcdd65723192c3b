package turnstile.core.util;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;

/**
 * IP literal parsing that never triggers DNS resolution.
 */
public final class IpAddresses {

    private IpAddresses() {}

    /**
     * Parse an IPv4 or IPv6 literal.
     *
     * <p>Hostnames are rejected before {@link InetAddress#getByName(String)} is
     * called, so no lookup ever happens. IPv4-mapped IPv6 addresses come back as
     * {@link java.net.Inet4Address}.
     *
     * @param literal the address text
     * @return the address, or empty if the text is not an IP literal
     */
    public static Optional<InetAddress> parseLiteral(String literal) {
        if (!looksLikeLiteral(literal)) {
            return Optional.empty();
        }
        try {
            return Optional.of(InetAddress.getByName(literal));
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }

    private static boolean looksLikeLiteral(String input) {
        if (input == null || input.isEmpty()) {
            return false;
        }
        if (input.indexOf(':') >= 0) {
            for (var i = 0; i < input.length(); i++) {
                final var c = input.charAt(i);
                if (Character.digit(c, 16) < 0 && c != ':' && c != '.') {
                    return false;
                }
            }
            return true;
        }
        var dots = 0;
        for (var i = 0; i < input.length(); i++) {
            final var c = input.charAt(i);
            if (c == '.') {
                dots++;
            } else if (!Character.isDigit(c)) {
                return false;
            }
        }
        return dots == 3;
    }
}
