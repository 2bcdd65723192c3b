package turnstile.system.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import turnstile.adapter.in.problem.AdmissionProblem;
import turnstile.core.model.admission.AdmissionRequest;
import turnstile.core.model.admission.AdmissionVerdict;
import turnstile.core.model.admission.AdmissionVerdict.DenialReason;
import turnstile.core.service.admission.AdmissionPolicies;
import turnstile.core.service.admission.AdmissionService;

@DisplayName("AdmissionFilter")
class AdmissionFilterTest {

    private static final Map<String, String> HEADERS = Map.of(
            AdmissionVerdict.LIMIT_HEADER, "100",
            AdmissionVerdict.USED_HEADER, "1",
            AdmissionVerdict.REMAINING_HEADER, "99",
            AdmissionVerdict.RESET_HEADER, "1700000900");

    private AdmissionService admission;
    private AdmissionPolicies policies;
    private ContainerRequestContext requestContext;
    private UriInfo uriInfo;
    private AdmissionFilter filter;

    @BeforeEach
    void setUp() {
        admission = mock(AdmissionService.class);
        policies = mock(AdmissionPolicies.class);
        requestContext = mock(ContainerRequestContext.class);
        uriInfo = mock(UriInfo.class);

        when(admission.policies()).thenReturn(policies);
        when(policies.resolveForPath(any())).thenReturn(AdmissionPolicies.STANDARD);
        when(requestContext.getUriInfo()).thenReturn(uriInfo);
        when(uriInfo.getPath()).thenReturn("/api/events");

        var address = mock(SocketAddress.class);
        when(address.host()).thenReturn("10.0.0.1");
        var httpRequest = mock(HttpServerRequest.class);
        when(httpRequest.remoteAddress()).thenReturn(address);

        filter = new AdmissionFilter(admission);
        filter.httpRequest = httpRequest;
    }

    @Nested
    @DisplayName("Request filter")
    class RequestFilterTests {

        @Test
        @DisplayName("should describe the request from headers and the connection")
        void shouldDescribeRequest() {
            when(requestContext.getHeaderString("X-Forwarded-For")).thenReturn("203.0.113.7, 10.0.0.1");
            when(requestContext.getHeaderString("User-Agent")).thenReturn("curl/8.0");
            when(admission.evaluate(any(), any())).thenReturn(AdmissionVerdict.allow(HEADERS));

            filter.filter(requestContext);

            var captor = ArgumentCaptor.forClass(AdmissionRequest.class);
            verify(admission).evaluate(eq(AdmissionPolicies.STANDARD), captor.capture());
            var request = captor.getValue();
            assertEquals("10.0.0.1", request.ip().orElseThrow());
            assertEquals("203.0.113.7, 10.0.0.1", request.forwardedFor().orElseThrow());
            assertEquals("/api/events", request.path());
            assertEquals("curl/8.0", request.userAgent().orElseThrow());
        }

        @Test
        @DisplayName("should select the policy by path")
        void shouldSelectPolicyByPath() {
            when(uriInfo.getPath()).thenReturn("webhooks/meta");
            when(policies.resolveForPath("/webhooks/meta")).thenReturn(AdmissionPolicies.WEBHOOK);
            when(admission.evaluate(any(), any())).thenReturn(AdmissionVerdict.allow());

            filter.filter(requestContext);

            verify(admission).evaluate(eq(AdmissionPolicies.WEBHOOK), any());
        }

        @Test
        @DisplayName("should let admitted requests through")
        void shouldPassAdmittedRequests() {
            var verdict = AdmissionVerdict.allow(HEADERS);
            when(admission.evaluate(any(), any())).thenReturn(verdict);

            filter.filter(requestContext);

            verify(requestContext).setProperty(AdmissionFilter.VERDICT_ATTR, verdict);
            verify(requestContext, never()).abortWith(any());
        }

        @Test
        @DisplayName("should abort denied requests with 429")
        void shouldAbortDeniedRequests() {
            var headers = new java.util.HashMap<>(HEADERS);
            headers.put(AdmissionVerdict.RETRY_AFTER_HEADER, "42");
            when(admission.evaluate(any(), any()))
                    .thenReturn(AdmissionVerdict.deny(DenialReason.RATE_LIMITED, 42, headers));

            filter.filter(requestContext);

            var captor = ArgumentCaptor.forClass(Response.class);
            verify(requestContext).abortWith(captor.capture());
            var response = captor.getValue();
            assertEquals(429, response.getStatus());
            assertEquals("42", response.getHeaderString("Retry-After"));
            assertEquals("100", response.getHeaderString("X-RateLimit-Limit"));
            var body = assertInstanceOf(AdmissionProblem.class, response.getEntity());
            assertEquals(42L, body.retryAfter());
        }

        @Test
        @DisplayName("should add Retry-After to lockouts")
        void shouldAddRetryAfterToLockouts() {
            when(admission.evaluate(any(), any()))
                    .thenReturn(AdmissionVerdict.deny(DenialReason.LOCKED_OUT, 900, Map.of()));

            filter.filter(requestContext);

            var captor = ArgumentCaptor.forClass(Response.class);
            verify(requestContext).abortWith(captor.capture());
            assertEquals(429, captor.getValue().getStatus());
            assertEquals("900", captor.getValue().getHeaderString("Retry-After"));
        }
    }

    @Nested
    @DisplayName("Response filter")
    class ResponseFilterTests {

        private ContainerResponseContext responseContext;
        private MultivaluedMap<String, Object> responseHeaders;

        @BeforeEach
        void setUp() {
            responseContext = mock(ContainerResponseContext.class);
            responseHeaders = new MultivaluedHashMap<>();
            when(responseContext.getHeaders()).thenReturn(responseHeaders);
        }

        @Test
        @DisplayName("should copy rate limit headers onto the response")
        void shouldCopyHeaders() {
            when(requestContext.getProperty(AdmissionFilter.VERDICT_ATTR)).thenReturn(AdmissionVerdict.allow(HEADERS));

            filter.filter(requestContext, responseContext);

            assertEquals("99", responseHeaders.getFirst(AdmissionVerdict.REMAINING_HEADER));
            assertEquals("1700000900", responseHeaders.getFirst(AdmissionVerdict.RESET_HEADER));
        }

        @Test
        @DisplayName("should not overwrite headers set by the resource")
        void shouldKeepExistingHeaders() {
            responseHeaders.add(AdmissionVerdict.LIMIT_HEADER, "5");
            when(requestContext.getProperty(AdmissionFilter.VERDICT_ATTR)).thenReturn(AdmissionVerdict.allow(HEADERS));

            filter.filter(requestContext, responseContext);

            assertEquals("5", responseHeaders.getFirst(AdmissionVerdict.LIMIT_HEADER));
        }

        @Test
        @DisplayName("should ignore requests without a verdict")
        void shouldIgnoreMissingVerdict() {
            filter.filter(requestContext, responseContext);

            assertTrue(responseHeaders.isEmpty());
        }
    }
}
