package turnstile.system.filter;

import jakarta.ws.rs.container.ContainerRequestContext;

import io.vertx.core.http.HttpServerRequest;

import turnstile.core.model.admission.AdmissionRequest;

/**
 * Builds {@link AdmissionRequest} descriptors from JAX-RS request contexts.
 */
final class RequestDescriptors {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    static final String USER_AGENT_HEADER = "User-Agent";

    private RequestDescriptors() {}

    static AdmissionRequest describe(ContainerRequestContext ctx, HttpServerRequest httpRequest) {
        return AdmissionRequest.of(
                        remoteAddress(httpRequest), ctx.getHeaderString(FORWARDED_FOR_HEADER), path(ctx))
                .withUserAgent(ctx.getHeaderString(USER_AGENT_HEADER));
    }

    static String path(ContainerRequestContext ctx) {
        final var path = ctx.getUriInfo().getPath();
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.startsWith("/") ? path : "/" + path;
    }

    private static String remoteAddress(HttpServerRequest httpRequest) {
        if (httpRequest == null || httpRequest.remoteAddress() == null) {
            return null;
        }
        return httpRequest.remoteAddress().host();
    }
}
