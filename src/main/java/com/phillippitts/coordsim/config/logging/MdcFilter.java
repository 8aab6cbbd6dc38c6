package com.phillippitts.coordsim.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every API call with a correlation id so simulation logs can be traced per request.
 *
 * <p>The id comes from {@code X-Request-ID} when the caller sends one and is returned in the
 * same response header. The stage executor copies these keys to its workers, and the
 * orchestrator adds {@code sessionId} while a workflow runs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String USER_ID_HEADER = "X-User-ID";

    static final String MDC_REQUEST_ID = "requestId";
    static final String MDC_USER_ID = "userId";
    static final String MDC_METHOD = "method";
    static final String MDC_URI = "uri";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = correlationId(http);
                bind(http, requestId);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static void bind(HttpServletRequest http, String requestId) {
        ThreadContext.put(MDC_REQUEST_ID, requestId);
        ThreadContext.put(MDC_METHOD, http.getMethod());
        ThreadContext.put(MDC_URI, http.getRequestURI());
        String userId = http.getHeader(USER_ID_HEADER);
        if (userId != null && !userId.isBlank()) {
            ThreadContext.put(MDC_USER_ID, userId.strip());
        }
    }

    private static String correlationId(HttpServletRequest http) {
        String supplied = http.getHeader(REQUEST_ID_HEADER);
        if (supplied == null || supplied.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return supplied.strip();
    }
}
