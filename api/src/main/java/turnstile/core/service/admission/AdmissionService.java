package turnstile.core.service.admission;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import turnstile.core.config.AdmissionConfig;
import turnstile.core.model.admission.AdmissionPolicy;
import turnstile.core.model.admission.AdmissionRequest;
import turnstile.core.model.admission.AdmissionVerdict;
import turnstile.core.model.admission.AdmissionVerdict.DenialReason;
import turnstile.core.model.ratelimit.RateLimitAlgorithm;
import turnstile.core.model.ratelimit.RateLimitDecision;
import turnstile.core.model.ratelimit.RateLimitKey;
import turnstile.core.port.out.AdmissionMetrics;
import turnstile.core.port.out.LimiterStateStoreFactory;
import turnstile.core.port.out.SecurityEventPublisher;
import turnstile.core.service.auth.BruteForceGuard;
import turnstile.core.service.common.ClientKeyResolver;
import turnstile.core.service.ratelimit.SlidingWindowRateLimiter;
import turnstile.core.service.ratelimit.TokenBucketRateLimiter;
import turnstile.core.util.ClientFingerprint;
import turnstile.spi.SecurityEvent;

/**
 * Single entry point for admission decisions.
 *
 * <p>Binds named policies to limiter instances and derives the client key from
 * the request. For policies with brute force protection the lockout is checked
 * before the rate limiter, so a locked client consumes no quota. Denials raise
 * a {@link SecurityEvent.RateLimitExceeded} with the policy's alert severity.
 *
 * <p>Unknown policy names and a disabled admission layer both admit the request.
 */
@ApplicationScoped
public class AdmissionService {

    private static final Logger LOG = Logger.getLogger(AdmissionService.class);

    private final AdmissionConfig config;
    private final AdmissionPolicies policies;
    private final SlidingWindowRateLimiter slidingWindow;
    private final BruteForceGuard bruteForceGuard;
    private final ClientKeyResolver clientKeyResolver;
    private final SecurityEventPublisher events;
    private final AdmissionMetrics metrics;
    private final Clock clock;
    private final Map<String, TokenBucketRateLimiter> tokenBuckets = new ConcurrentHashMap<>();

    @Inject
    public AdmissionService(
            AdmissionConfig config,
            AdmissionPolicies policies,
            SlidingWindowRateLimiter slidingWindow,
            BruteForceGuard bruteForceGuard,
            ClientKeyResolver clientKeyResolver,
            LimiterStateStoreFactory stores,
            SecurityEventPublisher events,
            AdmissionMetrics metrics,
            Clock clock) {
        this.config = config;
        this.policies = policies;
        this.slidingWindow = slidingWindow;
        this.bruteForceGuard = bruteForceGuard;
        this.clientKeyResolver = clientKeyResolver;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;

        for (final var policy : policies.all()) {
            if (policy.algorithm() == RateLimitAlgorithm.TOKEN_BUCKET) {
                final var bucket = policy.toTokenBucketConfig();
                tokenBuckets.put(
                        policy.name(),
                        new TokenBucketRateLimiter(
                                policy.name(),
                                stores.create(
                                        "token-bucket-" + policy.name(), TokenBucketRateLimiter.retention(bucket)),
                                clock,
                                bucket));
            } else {
                slidingWindow.initialize(policy.toSlidingWindowPolicy());
            }
        }
    }

    /**
     * Decide whether a request may proceed under a policy.
     *
     * @param policyName the policy
     * @param request the request descriptor
     * @return the verdict with rate limit headers
     */
    public AdmissionVerdict evaluate(String policyName, AdmissionRequest request) {
        if (!config.enabled()) {
            return AdmissionVerdict.allow();
        }

        final var found = policies.get(policyName);
        if (found.isEmpty()) {
            LOG.warnf("Admission policy %s is not configured; allowing request", policyName);
            return AdmissionVerdict.allow();
        }

        final var policy = found.get();
        final var clientKey = clientKeyResolver.resolve(request);

        if (policy.bruteForce()) {
            final var guardKey = guardKey(policy.name(), clientKey);
            if (bruteForceGuard.isLocked(guardKey)) {
                final var remainingMillis = bruteForceGuard.getLockoutTimeRemaining(guardKey);
                final var retryAfter = Math.max(1, (remainingMillis + 999) / 1000);
                LOG.debugf("Client %s is locked out of policy %s", ClientFingerprint.of(clientKey), policy.name());
                recordDecision(policy.name(), false, DenialReason.LOCKED_OUT);
                final var headers = headers(status(policy, clientKey));
                headers.put(AdmissionVerdict.RETRY_AFTER_HEADER, Long.toString(retryAfter));
                return AdmissionVerdict.deny(DenialReason.LOCKED_OUT, retryAfter, headers);
            }
        }

        final var decision = consume(policy, clientKey);
        if (decision.allowed()) {
            recordDecision(policy.name(), true, DenialReason.NONE);
            return config.includeHeaders() ? AdmissionVerdict.allow(headers(decision)) : AdmissionVerdict.allow();
        }

        events.publish(new SecurityEvent.RateLimitExceeded(
                clock.instant(),
                ClientFingerprint.of(clientKey),
                policy.name(),
                request.path(),
                (int) decision.used(),
                (int) decision.limit(),
                policy.window().toSeconds(),
                policy.alertSeverity()));
        recordDecision(policy.name(), false, DenialReason.RATE_LIMITED);

        final var headers = headers(decision);
        headers.put(AdmissionVerdict.RETRY_AFTER_HEADER, Long.toString(decision.retryAfterSeconds()));
        return AdmissionVerdict.deny(DenialReason.RATE_LIMITED, decision.retryAfterSeconds(), headers);
    }

    /**
     * Record a failed authentication-like attempt (bad OAuth state, bad
     * credentials) against the policy's brute force guard.
     *
     * @param policyName the policy
     * @param request the request descriptor
     * @return attempts left before lockout; 0 once locked
     */
    public int recordFailure(String policyName, AdmissionRequest request) {
        final var clientKey = clientKeyResolver.resolve(request);
        final var outcome = bruteForceGuard.registerFailure(guardKey(policyName, clientKey));

        if (outcome.lockStarted()) {
            events.publish(new SecurityEvent.BruteForceLockout(
                    clock.instant(),
                    ClientFingerprint.of(clientKey),
                    policyName,
                    outcome.failureCount(),
                    bruteForceGuard.policy().lockoutDuration().toSeconds()));
            if (metrics.isEnabled()) {
                metrics.recordLockout(policyName);
            }
        }
        return outcome.remainingAttempts();
    }

    /**
     * Clear the failure history of a client after a successful attempt.
     *
     * @param policyName the policy
     * @param request the request descriptor
     */
    public void recordSuccess(String policyName, AdmissionRequest request) {
        bruteForceGuard.recordSuccess(guardKey(policyName, clientKeyResolver.resolve(request)));
    }

    /**
     * Forget a client's usage under a policy.
     *
     * @param policyName the policy
     * @param request the request descriptor
     */
    public void reset(String policyName, AdmissionRequest request) {
        final var clientKey = clientKeyResolver.resolve(request);
        final var tokenBucket = tokenBuckets.get(policyName);
        if (tokenBucket != null) {
            tokenBucket.reset(clientKey);
        } else {
            slidingWindow.reset(policyName, clientKey);
        }
    }

    public AdmissionPolicies policies() {
        return policies;
    }

    private RateLimitDecision consume(AdmissionPolicy policy, String clientKey) {
        if (policy.algorithm() == RateLimitAlgorithm.TOKEN_BUCKET) {
            final var limiter = tokenBuckets.get(policy.name());
            if (limiter == null) {
                LOG.warnf("Token bucket for policy %s is not configured; allowing request", policy.name());
                return RateLimitDecision.unconfigured();
            }
            return limiter.checkAndConsume(clientKey, 1);
        }
        return slidingWindow.checkAndConsume(policy.name(), clientKey);
    }

    // Current usage without consuming quota
    private RateLimitDecision status(AdmissionPolicy policy, String clientKey) {
        if (policy.algorithm() == RateLimitAlgorithm.TOKEN_BUCKET) {
            final var limiter = tokenBuckets.get(policy.name());
            return limiter == null ? RateLimitDecision.unconfigured() : limiter.status(clientKey);
        }
        final var status = slidingWindow.getStatus(policy.name(), clientKey);
        return new RateLimitDecision(
                status.remaining() > 0, status.limit(), status.used(), status.remaining(), status.resetAtMillis(), 0);
    }

    private void recordDecision(String policy, boolean allowed, DenialReason reason) {
        if (metrics.isEnabled()) {
            metrics.recordDecision(policy, allowed, reason.name().toLowerCase(Locale.ROOT));
        }
    }

    private static Map<String, String> headers(RateLimitDecision decision) {
        final var headers = new LinkedHashMap<String, String>();
        if (decision.limit() == 0 && decision.resetAtMillis() == 0) {
            return headers;
        }
        headers.put(AdmissionVerdict.LIMIT_HEADER, Long.toString(decision.limit()));
        headers.put(AdmissionVerdict.USED_HEADER, Long.toString(decision.used()));
        headers.put(AdmissionVerdict.REMAINING_HEADER, Long.toString(decision.remaining()));
        headers.put(AdmissionVerdict.RESET_HEADER, Long.toString(decision.resetAtEpochSeconds()));
        return headers;
    }

    private static String guardKey(String policyName, String clientKey) {
        return RateLimitKey.of(policyName, clientKey).toCacheKey();
    }
}
