package turnstile.core.service.common;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.util.regex.Pattern;

import turnstile.core.util.IpAddresses;

/**
 * Canonicalizes client addresses into stable rate limit keys.
 *
 * <p>IPv6 clients can rotate through the host part of their prefix and pick
 * between several textual spellings of the same address. Addresses are parsed,
 * masked to the configured prefix and printed in RFC 5952 form, so
 * {@code 2001:DB8:0:0:1::1} and {@code 2001:db8::1:0:0:1} share a key, as do
 * all hosts of one /64 when the prefix is 64.
 *
 * <p>IPv4 and IPv4-mapped IPv6 addresses are returned in dotted form. Input that
 * is not an IP literal is returned trimmed and lowercased.
 */
public final class IpAddressNormalizer {

    private static final Pattern IPV4_WITH_PORT = Pattern.compile("^(\\d{1,3}(?:\\.\\d{1,3}){3}):\\d+$");
    private static final int IPV6_GROUPS = 8;

    private final int ipv6PrefixLength;

    /**
     * Creates a normalizer.
     *
     * @param ipv6PrefixLength prefix length IPv6 addresses are masked to (1-128)
     */
    public IpAddressNormalizer(int ipv6PrefixLength) {
        if (ipv6PrefixLength < 1 || ipv6PrefixLength > 128) {
            throw new IllegalArgumentException("ipv6PrefixLength must be between 1 and 128, got " + ipv6PrefixLength);
        }
        this.ipv6PrefixLength = ipv6PrefixLength;
    }

    /**
     * Normalize an address.
     *
     * @param address the raw address (may include brackets, a port or a zone id)
     * @return the canonical key, or the trimmed input if it is not an IP literal
     */
    public String normalize(String address) {
        if (address == null) {
            return null;
        }
        final var literal = stripDecorations(address.trim());
        final var parsed = IpAddresses.parseLiteral(literal);
        if (parsed.isEmpty()) {
            return address.trim().toLowerCase();
        }
        final var inet = parsed.get();
        if (inet instanceof Inet4Address) {
            return inet.getHostAddress();
        }
        if (inet instanceof Inet6Address v6) {
            return formatIpv6(mask(v6.getAddress()));
        }
        return literal;
    }

    public int ipv6PrefixLength() {
        return ipv6PrefixLength;
    }

    private static String stripDecorations(String address) {
        var value = address;
        if (value.startsWith("[")) {
            final var close = value.indexOf(']');
            value = close > 0 ? value.substring(1, close) : value.substring(1);
        }
        final var ipv4Port = IPV4_WITH_PORT.matcher(value);
        if (ipv4Port.matches()) {
            value = ipv4Port.group(1);
        }
        final var zone = value.indexOf('%');
        if (zone > 0) {
            value = value.substring(0, zone);
        }
        return value;
    }

    private byte[] mask(byte[] bytes) {
        final var masked = bytes.clone();
        final var fullBytes = ipv6PrefixLength / 8;
        final var remainingBits = ipv6PrefixLength % 8;
        if (fullBytes < masked.length && remainingBits > 0) {
            masked[fullBytes] = (byte) (masked[fullBytes] & (0xFF << (8 - remainingBits)));
        }
        for (var i = fullBytes + (remainingBits > 0 ? 1 : 0); i < masked.length; i++) {
            masked[i] = 0;
        }
        return masked;
    }

    private String formatIpv6(byte[] bytes) {
        final var groups = new int[IPV6_GROUPS];
        for (var i = 0; i < IPV6_GROUPS; i++) {
            groups[i] = ((bytes[2 * i] & 0xFF) << 8) | (bytes[2 * i + 1] & 0xFF);
        }

        // RFC 5952 4.2: compress the longest run of two or more zero groups, the first on ties
        var bestStart = -1;
        var bestLength = 0;
        for (var i = 0; i < IPV6_GROUPS; ) {
            if (groups[i] != 0) {
                i++;
                continue;
            }
            var j = i;
            while (j < IPV6_GROUPS && groups[j] == 0) {
                j++;
            }
            if (j - i > bestLength) {
                bestStart = i;
                bestLength = j - i;
            }
            i = j;
        }
        if (bestLength < 2) {
            bestStart = -1;
        }

        final var sb = new StringBuilder(39);
        for (var i = 0; i < IPV6_GROUPS; i++) {
            if (i == bestStart) {
                sb.append("::");
                i += bestLength - 1;
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') {
                sb.append(':');
            }
            sb.append(Integer.toHexString(groups[i]));
        }
        if (ipv6PrefixLength < 128) {
            sb.append('/').append(ipv6PrefixLength);
        }
        return sb.toString();
    }
}
