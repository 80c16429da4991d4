package com.csvinsight.profiler;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

class RequestMdcFilterTest {

  private final RequestMdcFilter filter = new RequestMdcFilter();

  private MockFilterChain capturingChain(AtomicReference<String> seen) {
    return new MockFilterChain(
        new HttpServlet() {
          @Override
          protected void service(HttpServletRequest req, HttpServletResponse resp) {
            seen.set(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY));
          }
        });
  }

  @Test
  void shouldReuseCorrelationIdFromHeader() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/datasets");
    request.addHeader(RequestMdcFilter.CORRELATION_ID_HEADER, "req-42");
    MockHttpServletResponse response = new MockHttpServletResponse();
    AtomicReference<String> seen = new AtomicReference<>();

    filter.doFilter(request, response, capturingChain(seen));

    assertThat(seen.get()).isEqualTo("req-42");
    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER)).isEqualTo("req-42");
    assertThat(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY)).isNull();
  }

  @Test
  void shouldGenerateCorrelationIdWhenAbsent() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    AtomicReference<String> seen = new AtomicReference<>();

    filter.doFilter(
        new MockHttpServletRequest("GET", "/api/datasets"), response, capturingChain(seen));

    assertThat(seen.get()).isNotBlank();
    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER)).isEqualTo(seen.get());
  }
}
