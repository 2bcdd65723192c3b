package turnstile.system.filter;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Set;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;

import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import turnstile.adapter.in.problem.AdmissionProblem;
import turnstile.core.config.SignatureConfig;
import turnstile.core.model.signature.SignatureFormat;
import turnstile.core.port.out.AdmissionMetrics;
import turnstile.core.port.out.SecurityEventPublisher;
import turnstile.core.service.common.ClientKeyResolver;
import turnstile.core.service.signature.HmacSignatureEngine;
import turnstile.core.util.ClientFingerprint;
import turnstile.spi.SecurityEvent;

/**
 * JAX-RS filter that verifies webhook signatures.
 *
 * <p>For requests with a body on a configured webhook path, the raw body is
 * verified against the {@code sha256=<hex>} signature header using the webhook
 * secret. The body stream is restored afterwards so resources can read it.
 * A missing secret rejects every webhook. Failures answer 401 without detail.
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class WebhookSignatureFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(WebhookSignatureFilter.class);

    private static final Set<String> METHODS_WITH_BODY = Set.of("POST", "PUT", "PATCH");

    private final HmacSignatureEngine engine;
    private final SignatureConfig config;
    private final ClientKeyResolver clientKeyResolver;
    private final SecurityEventPublisher events;
    private final AdmissionMetrics metrics;
    private final Clock clock;
    private final List<String> webhookPaths;

    @Context
    HttpServerRequest httpRequest;

    @Inject
    public WebhookSignatureFilter(
            HmacSignatureEngine engine,
            SignatureConfig config,
            ClientKeyResolver clientKeyResolver,
            SecurityEventPublisher events,
            AdmissionMetrics metrics,
            Clock clock) {
        this.engine = engine;
        this.config = config;
        this.clientKeyResolver = clientKeyResolver;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
        this.webhookPaths = config.webhookPaths().orElse(List.of());
    }

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        final var path = RequestDescriptors.path(requestContext);
        if (!METHODS_WITH_BODY.contains(requestContext.getMethod()) || !isWebhookPath(path)) {
            return;
        }

        final var body = requestContext.getEntityStream().readAllBytes();
        requestContext.setEntityStream(new ByteArrayInputStream(body));

        final var signature = requestContext.getHeaderString(config.webhookHeader());
        final var secret = config.webhookSecret().orElse(null);
        final var result = engine.verify(body, signature, secret, SignatureFormat.PREFIXED_HEX);

        if (metrics.isEnabled()) {
            metrics.recordSignatureVerification(SignatureFormat.PREFIXED_HEX.wireName(), result.valid());
        }
        if (result.valid()) {
            return;
        }

        final var reason = result.error().orElse("invalid");
        final var client = ClientFingerprint.of(
                clientKeyResolver.resolve(RequestDescriptors.describe(requestContext, httpRequest)));
        LOG.debugf("Rejected webhook signature on %s from client %s: %s", path, client, reason);
        events.publish(new SecurityEvent.SignatureRejected(clock.instant(), client, path, reason));

        requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED)
                .type(MediaType.APPLICATION_JSON)
                .entity(AdmissionProblem.unauthorized())
                .build());
    }

    private boolean isWebhookPath(String path) {
        for (final var prefix : webhookPaths) {
            if (path.equals(prefix) || path.startsWith(prefix.endsWith("/") ? prefix : prefix + "/")) {
                return true;
            }
        }
        return false;
    }
}
