package turnstile.core.model.signature;

/**
 * Wire formats for HMAC-SHA256 signatures.
 */
public enum SignatureFormat {

    /** Bare lowercase hex digest, used for the OAuth state parameter. */
    HEX("hex", ""),

    /** Digest prefixed with {@code sha256=}, used in webhook signature headers. */
    PREFIXED_HEX("sha256=hex", "sha256=");

    private final String wireName;
    private final String prefix;

    SignatureFormat(String wireName, String prefix) {
        this.wireName = wireName;
        this.prefix = prefix;
    }

    public String wireName() {
        return wireName;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Formats a hex digest for this wire format.
     *
     * @param hexDigest the lowercase hex digest
     * @return the formatted signature
     */
    public String format(String hexDigest) {
        return prefix + hexDigest;
    }
}
