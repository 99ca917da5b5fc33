package org.chucc.graphserver.filter;

import com.github.f4b6a3.uuid.UuidCreator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that assigns a correlation ID to each HTTP request.
 *
 * <p>An incoming {@value #HEADER} header is reused; otherwise a UUIDv7 is minted. The ID is
 * stored in SLF4J MDC for the logging pattern and echoed in the response header.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

  /**
   * MDC key for correlation ID (used in the logging pattern).
   */
  public static final String CORRELATION_ID_KEY = "correlationId";

  /**
   * Request and response header carrying the correlation ID.
   */
  public static final String HEADER = "X-Correlation-ID";

  private static final int MAX_LENGTH = 128;

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String correlationId = request.getHeader(HEADER);
    if (correlationId == null || correlationId.isBlank() || correlationId.length() > MAX_LENGTH) {
      correlationId = UuidCreator.getTimeOrderedEpoch().toString();
    }

    MDC.put(CORRELATION_ID_KEY, correlationId);
    response.setHeader(HEADER, correlationId);
    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(CORRELATION_ID_KEY);
    }
  }
}
