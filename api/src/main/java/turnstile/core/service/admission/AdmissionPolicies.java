package turnstile.core.service.admission;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import turnstile.core.config.AdmissionConfig;
import turnstile.core.model.admission.AdmissionPolicy;
import turnstile.core.model.ratelimit.RateLimitAlgorithm;
import turnstile.spi.SecurityEvent.Severity;

/**
 * Registry of named admission policies and the routes that select them.
 *
 * <p>The built-in policies are always present and may be overridden or extended
 * through configuration. Routes map path prefixes to policy names; the longest
 * matching prefix wins and unmatched paths use the default policy.
 */
@ApplicationScoped
public class AdmissionPolicies {

    private static final Logger LOG = Logger.getLogger(AdmissionPolicies.class);

    public static final String STANDARD = "standard";
    public static final String WEBHOOK = "webhook";
    public static final String OAUTH = "oauth";
    public static final String SYNC = "sync";
    public static final String TOKEN_REFRESH = "token-refresh";

    private final Map<String, AdmissionPolicy> policies;
    private final Map<String, String> routes;
    private final String defaultPolicy;

    @Inject
    public AdmissionPolicies(AdmissionConfig config) {
        this(merge(config.policies()), config.routes(), config.defaultPolicy());
    }

    public AdmissionPolicies(Map<String, AdmissionPolicy> policies, Map<String, String> routes, String defaultPolicy) {
        this.policies = Map.copyOf(policies);
        this.routes = Map.copyOf(routes);
        this.defaultPolicy = defaultPolicy;

        routes.forEach((prefix, policy) -> {
            if (!this.policies.containsKey(policy)) {
                LOG.warnf("Route %s refers to unknown admission policy %s", prefix, policy);
            }
        });
        LOG.infof("Loaded admission policies: %s", this.policies.keySet());
    }

    /**
     * The policies every deployment starts with.
     *
     * @return built-in policies by name
     */
    public static Map<String, AdmissionPolicy> builtIn() {
        final var defaults = new LinkedHashMap<String, AdmissionPolicy>();
        defaults.put(STANDARD, AdmissionPolicy.slidingWindow(STANDARD, 100, Duration.ofMinutes(15)));
        defaults.put(
                WEBHOOK,
                AdmissionPolicy.slidingWindow(WEBHOOK, 1000, Duration.ofMinutes(1))
                        .withAlertSeverity(Severity.CRITICAL));
        defaults.put(
                OAUTH, AdmissionPolicy.slidingWindow(OAUTH, 10, Duration.ofMinutes(15)).withBruteForce(true));
        defaults.put(
                SYNC,
                new AdmissionPolicy(
                        SYNC, RateLimitAlgorithm.TOKEN_BUCKET, 10, Duration.ofDays(1), Severity.WARNING, false));
        defaults.put(
                TOKEN_REFRESH,
                new AdmissionPolicy(
                        TOKEN_REFRESH,
                        RateLimitAlgorithm.TOKEN_BUCKET,
                        24,
                        Duration.ofDays(1),
                        Severity.WARNING,
                        false));
        return defaults;
    }

    public Optional<AdmissionPolicy> get(String name) {
        return Optional.ofNullable(policies.get(name));
    }

    public Collection<AdmissionPolicy> all() {
        return policies.values();
    }

    public String defaultPolicy() {
        return defaultPolicy;
    }

    /**
     * Select the policy name for a request path.
     *
     * @param path the request path
     * @return the policy routed to the longest matching prefix, or the default policy
     */
    public String resolveForPath(String path) {
        if (path == null) {
            return defaultPolicy;
        }
        String bestPrefix = null;
        for (final var prefix : routes.keySet()) {
            if (matches(path, prefix) && (bestPrefix == null || prefix.length() > bestPrefix.length())) {
                bestPrefix = prefix;
            }
        }
        return bestPrefix == null ? defaultPolicy : routes.get(bestPrefix);
    }

    /**
     * Paths routed to a policy, used by filters that only act on some routes.
     *
     * @param policyName the policy
     * @return the configured prefixes
     */
    public List<String> prefixesFor(String policyName) {
        return routes.entrySet().stream()
                .filter(e -> e.getValue().equals(policyName))
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    // "/api/sync" matches "/api/sync" and "/api/sync/x" but not "/api/syncer"
    static boolean matches(String path, String prefix) {
        if (!path.startsWith(prefix)) {
            return false;
        }
        return path.length() == prefix.length() || prefix.endsWith("/") || path.charAt(prefix.length()) == '/';
    }

    private static Map<String, AdmissionPolicy> merge(Map<String, AdmissionConfig.PolicyConfig> configured) {
        final var merged = builtIn();
        configured.forEach((name, policy) -> merged.put(
                name,
                new AdmissionPolicy(
                        name,
                        policy.algorithm(),
                        policy.maxRequests(),
                        policy.window(),
                        policy.alertSeverity(),
                        policy.bruteForce())));
        return merged;
    }
}
