package com.di.bqindexer.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every HTTP request to the indexer API with a request id so that the log
 * lines of a run triggered over HTTP can be found from the caller's side.
 *
 * <p>An {@code X-Request-Id} sent by the caller (or added by the load balancer)
 * is reused when it is a short token; otherwise one is generated. The id is
 * echoed in the response header and, with the request path, put into the MDC
 * for the duration of the request. Both end up in the error body built by
 * {@link com.di.bqindexer.exception.GlobalExceptionHandler}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcRequestFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID        = "requestId";
    public static final String REQUEST_PATH      = "requestPath";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = resolveRequestId(request.getHeader(REQUEST_ID_HEADER));
        String path = request.getRequestURI();
        MDC.put(REQUEST_ID, requestId);
        MDC.put(REQUEST_PATH, path != null ? path : "");
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID);
            MDC.remove(REQUEST_PATH);
        }
    }

    /** Incoming id when it is safe to log verbatim, else a fresh {@code req-xxxxxxxx}. */
    static String resolveRequestId(String incoming) {
        if (incoming != null && ACCEPTED_ID.matcher(incoming.trim()).matches()) {
            return incoming.trim();
        }
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
