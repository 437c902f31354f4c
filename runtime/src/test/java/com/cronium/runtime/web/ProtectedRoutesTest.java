package com.cronium.runtime.web;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class ProtectedRoutesTest {

    @Test
    void stateAndToolRoutes_requireAuthentication() {
        assertThat(ProtectedRoutes.requiresAuthentication(new MockHttpServletRequest("GET", "/executions/e-1/input"))).isTrue();
        assertThat(ProtectedRoutes.requiresAuthentication(new MockHttpServletRequest("POST", "/tool-actions/execute"))).isTrue();
    }

    @Test
    void operationalRoutesAndPreflight_open() {
        assertThat(ProtectedRoutes.requiresAuthentication(new MockHttpServletRequest("GET", "/health"))).isFalse();
        assertThat(ProtectedRoutes.requiresAuthentication(new MockHttpServletRequest("GET", "/metrics"))).isFalse();
        assertThat(ProtectedRoutes.requiresAuthentication(new MockHttpServletRequest("OPTIONS", "/executions/e-1/input"))).isFalse();
    }

    @Test
    void contextPath_strippedBeforeMatching() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/runtime/executions/e-1/context");
        request.setContextPath("/runtime");

        assertThat(ProtectedRoutes.requiresAuthentication(request)).isTrue();
    }
}
