package com.ospicorp.stockfeed.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Access log for the feed endpoints. Every request gets a request id, taken from
 * {@code X-Request-Id} when the caller sends a sane one, which is put in the MDC for the duration
 * of the request and echoed on the response. The access line records the negotiated content type
 * so JSON and CSV history downloads can be told apart. Actuator probes are logged at debug.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String REQUEST_ID_KEY = "requestId";

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
  private static final Pattern SAFE_REQUEST_ID = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    String requestId = requestId(request);
    MDC.put(REQUEST_ID_KEY, requestId);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    long startTime = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} from {} failed: {}",
          request.getMethod(),
          requestUriWithQuery(request),
          clientIp(request),
          ex.getMessage(),
          ex);
      throw ex;
    } finally {
      long durationMs = (System.nanoTime() - startTime) / 1_000_000;
      String contentType = response.getContentType() != null ? response.getContentType() : "-";
      if (isProbe(request)) {
        log.debug("HTTP {} {} -> {} ({} ms)", request.getMethod(), request.getRequestURI(),
            response.getStatus(), durationMs);
      } else {
        log.info("HTTP {} {} from {} -> {} {} ({} ms)",
            request.getMethod(),
            requestUriWithQuery(request),
            clientIp(request),
            response.getStatus(),
            contentType,
            durationMs);
      }
      MDC.remove(REQUEST_ID_KEY);
    }
  }

  static String requestId(HttpServletRequest request) {
    String supplied = request.getHeader(REQUEST_ID_HEADER);
    if (supplied != null && SAFE_REQUEST_ID.matcher(supplied).matches()) {
      return supplied;
    }
    return UUID.randomUUID().toString();
  }

  static boolean isProbe(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  static String requestUriWithQuery(HttpServletRequest request) {
    String queryString = request.getQueryString();
    if (queryString == null || queryString.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + queryString;
  }

  static String clientIp(HttpServletRequest request) {
    String forwardedHeader = request.getHeader("X-Forwarded-For");
    if (forwardedHeader != null && !forwardedHeader.isBlank()) {
      return forwardedHeader.split(",")[0].trim();
    }
    return request.getRemoteAddr();
  }
}
