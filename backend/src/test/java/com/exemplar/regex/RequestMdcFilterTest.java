package com.exemplar.regex;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import jakarta.servlet.FilterChain;

@DisplayName("RequestMdcFilter Tests")
class RequestMdcFilterTest {

  private final RequestMdcFilter filter = new RequestMdcFilter();
  private final Map<String, String> captured = new HashMap<>();
  private final FilterChain chain =
      (request, response) -> {
        captured.put("username", MDC.get(RequestMdcFilter.USERNAME_MDC_KEY));
        captured.put("correlationId", MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY));
      };

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  @Test
  void shouldUseHeadersWhenPresent() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/regex/generate");
    request.addHeader(RequestMdcFilter.USERNAME_HEADER, "alice");
    request.addHeader(RequestMdcFilter.CORRELATION_ID_HEADER, "req-42");
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(request, response, chain);

    assertThat(captured).containsEntry("username", "alice").containsEntry("correlationId", "req-42");
    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER)).isEqualTo("req-42");
  }

  @Test
  void shouldFallBackToDefaults() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/health");
    request.addHeader(RequestMdcFilter.USERNAME_HEADER, "  ");
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(request, response, chain);

    assertThat(captured).containsEntry("username", RequestMdcFilter.DEFAULT_USERNAME);
    String correlationId = captured.get("correlationId");
    assertThat(UUID.fromString(correlationId)).isNotNull();
    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER)).isEqualTo(correlationId);
  }

  @Test
  void shouldClearMdcAfterRequest() throws Exception {
    filter.doFilter(
        new MockHttpServletRequest("GET", "/api/health"), new MockHttpServletResponse(), chain);

    assertThat(MDC.get(RequestMdcFilter.USERNAME_MDC_KEY)).isNull();
    assertThat(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY)).isNull();
  }
}
