package io.b2mash.b2b.vatledger.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds {@code requestId} and {@code userId} into the MDC for the duration of a request and logs
 * one line per completed request. Registered inside the security chain (after bearer token
 * authentication), so it is not a component.
 */
public class RequestLoggingFilter extends OncePerRequestFilter {

  public static final String REQUEST_ID_HEADER = "X-Request-Id";

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  private static final String MDC_REQUEST_ID = "requestId";
  private static final String MDC_USER_ID = "userId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId == null || requestId.isBlank()) {
      requestId = UUID.randomUUID().toString();
    }
    long startNs = System.nanoTime();
    try {
      MDC.put(MDC_REQUEST_ID, requestId);
      response.setHeader(REQUEST_ID_HEADER, requestId);

      String subject = CurrentActor.subject();
      if (subject != null) {
        MDC.put(MDC_USER_ID, subject);
      }

      filterChain.doFilter(request, response);
    } finally {
      long durationMs = (System.nanoTime() - startNs) / 1_000_000;
      log.info(
          "{} {} -> {} ({}ms)",
          request.getMethod(),
          request.getRequestURI(),
          response.getStatus(),
          durationMs);
      MDC.remove(MDC_REQUEST_ID);
      MDC.remove(MDC_USER_ID);
    }
  }
}
