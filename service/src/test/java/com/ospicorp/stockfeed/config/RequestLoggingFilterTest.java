package com.ospicorp.stockfeed.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import jakarta.servlet.ServletException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestLoggingFilterTest {

  private final RequestLoggingFilter filter = new RequestLoggingFilter();

  @Test
  void includesQueryStringWhenPresent() {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/stocks/AAA/history");
    request.setQueryString("format=csv");

    assertThat(RequestLoggingFilter.requestUriWithQuery(request))
        .isEqualTo("/stocks/AAA/history?format=csv");
  }

  @Test
  void prefersFirstForwardedAddress() {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/stocks");
    request.setRemoteAddr("10.0.0.5");
    request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");

    assertThat(RequestLoggingFilter.clientIp(request)).isEqualTo("203.0.113.7");
  }

  @Test
  void fallsBackToRemoteAddress() {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/stocks");
    request.setRemoteAddr("10.0.0.5");

    assertThat(RequestLoggingFilter.clientIp(request)).isEqualTo("10.0.0.5");
  }

  @Test
  void echoesSuppliedRequestIdAndClearsMdc() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/stocks");
    request.addHeader(RequestLoggingFilter.REQUEST_ID_HEADER, "abc-123");
    MockHttpServletResponse response = new MockHttpServletResponse();
    AtomicReference<String> seenInChain = new AtomicReference<>();

    filter.doFilter(request, response,
        (req, res) -> seenInChain.set(MDC.get(RequestLoggingFilter.REQUEST_ID_KEY)));

    assertThat(seenInChain.get()).isEqualTo("abc-123");
    assertThat(response.getHeader(RequestLoggingFilter.REQUEST_ID_HEADER)).isEqualTo("abc-123");
    assertThat(MDC.get(RequestLoggingFilter.REQUEST_ID_KEY)).isNull();
  }

  @Test
  void replacesUnsafeRequestId() {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/stocks");
    request.addHeader(RequestLoggingFilter.REQUEST_ID_HEADER, "bad id\nforged log line");

    String requestId = RequestLoggingFilter.requestId(request);

    assertThat(requestId).isNotEqualTo("bad id\nforged log line");
    assertThat(UUID.fromString(requestId)).isNotNull();
  }

  @Test
  void actuatorRequestsAreProbes() {
    assertThat(RequestLoggingFilter.isProbe(new MockHttpServletRequest("GET", "/actuator/health")))
        .isTrue();
    assertThat(RequestLoggingFilter.isProbe(new MockHttpServletRequest("GET", "/stocks")))
        .isFalse();
  }

  @Test
  void rethrowsChainFailures() {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/stocks");
    MockHttpServletResponse response = new MockHttpServletResponse();

    assertThatThrownBy(() -> filter.doFilter(request, response, (req, res) -> {
      throw new ServletException("boom");
    })).isInstanceOf(ServletException.class).hasMessage("boom");
  }
}
