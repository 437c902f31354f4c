package com.cronium.runtime.web;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {

    RequestIdFilter filter = new RequestIdFilter();

    @Test
    void callerSuppliedId_echoedAndInMdcDuringRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/executions/e/input");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "req-1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req,
                                   HttpServletResponse resp) {
                seen.set(MDC.get("requestId"));
            }
        }));

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("req-1");
        assertThat(seen.get()).isEqualTo("req-1");
        assertThat(MDC.get("requestId")).isNull();
    }

    @Test
    void missingOrOversizedId_replacedWithGeneratedOne() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "x".repeat(200));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        String generated = response.getHeader(RequestIdFilter.REQUEST_ID_HEADER);
        assertThat(generated).isNotNull().hasSize(36);
    }
}
