package turnstile.system.filter;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;

import io.vertx.core.http.HttpServerRequest;

import turnstile.adapter.in.problem.AdmissionProblem;
import turnstile.core.model.admission.AdmissionVerdict;
import turnstile.core.model.admission.AdmissionVerdict.DenialReason;
import turnstile.core.service.admission.AdmissionService;

/**
 * JAX-RS filter that applies admission policies to incoming requests.
 *
 * <p>Runs before authentication so excessive traffic is refused before any
 * other work. The policy is selected by the longest configured route prefix
 * matching the request path. Denied requests get a 429 with {@code Retry-After}
 * and the rate limit headers; admitted requests get the rate limit headers on
 * their response.
 */
@Provider
@Priority(Priorities.AUTHENTICATION - 50)
public class AdmissionFilter implements ContainerRequestFilter, ContainerResponseFilter {

    static final String VERDICT_ATTR = "turnstile.admission.verdict";

    private final AdmissionService admission;

    @Context
    HttpServerRequest httpRequest;

    @Inject
    public AdmissionFilter(AdmissionService admission) {
        this.admission = admission;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        final var request = RequestDescriptors.describe(requestContext, httpRequest);
        final var policy = admission.policies().resolveForPath(request.path());
        final var verdict = admission.evaluate(policy, request);

        requestContext.setProperty(VERDICT_ATTR, verdict);
        if (!verdict.allowed()) {
            requestContext.abortWith(buildDeniedResponse(verdict));
        }
    }

    private Response buildDeniedResponse(AdmissionVerdict verdict) {
        final var retryAfter = verdict.retryAfterSeconds().orElse(1);
        final var body = verdict.reason() == DenialReason.LOCKED_OUT
                ? AdmissionProblem.lockedOut(retryAfter)
                : AdmissionProblem.tooManyRequests(retryAfter);

        final var response = Response.status(429).type(MediaType.APPLICATION_JSON).entity(body);
        verdict.headers().forEach(response::header);
        if (!verdict.headers().containsKey(AdmissionVerdict.RETRY_AFTER_HEADER)) {
            response.header(AdmissionVerdict.RETRY_AFTER_HEADER, retryAfter);
        }
        return response.build();
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        final var verdict = (AdmissionVerdict) requestContext.getProperty(VERDICT_ATTR);
        if (verdict == null || !verdict.allowed()) {
            return;
        }
        verdict.headers().forEach((name, value) -> {
            if (!responseContext.getHeaders().containsKey(name)) {
                responseContext.getHeaders().add(name, value);
            }
        });
    }
}
