package com.aiprofessor.simulation.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiprofessor.observability.CorrelationContext;
import com.aiprofessor.observability.CorrelationContextHolder;
import com.aiprofessor.security.JwtTokenService;
import com.aiprofessor.security.PlatformSecurityContext;
import com.aiprofessor.security.TokenSettings;
import com.aiprofessor.security.testing.TestSecurityContextFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("JwtAuthenticationFilter")
class JwtAuthenticationFilterTest {

    private final JwtTokenService tokens =
            new JwtTokenService(
                    new TokenSettings(
                            "test-secret-with-at-least-thirty-two-characters", "aiprofessor-test", null, null));
    private final JwtAuthenticationFilter filter =
            new JwtAuthenticationFilter(tokens, TestMessages.create(), new ObjectMapper());

    @AfterEach
    void tearDown() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("attaches the verified caller and enriches the correlation context")
    void attachesCaller() throws Exception {
        CorrelationContextHolder.set(CorrelationContext.anonymous("corr-1", "req-1"));
        String token =
                tokens.issueSimulation(
                                TestSecurityContextFactory.simulation().user(),
                                TestSecurityContextFactory.simulation().simulation())
                        .accessToken();
        var request = new MockHttpServletRequest("GET", "/api/simulation/status");
        request.addHeader("Authorization", "Bearer " + token);
        AtomicReference<CorrelationContext> seen = new AtomicReference<>();
        var chain =
                new MockFilterChain() {
                    @Override
                    public void doFilter(ServletRequest req, ServletResponse res) {
                        seen.set(CorrelationContextHolder.get().orElseThrow());
                    }
                };

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        PlatformSecurityContext caller = RequestSecurityContext.find(request).orElseThrow();
        assertThat(caller.isSimulation()).isTrue();
        assertThat(seen.get().userId()).isEqualTo(TestSecurityContextFactory.STUDENT_ID);
        assertThat(seen.get().simulationSessionId()).isEqualTo(TestSecurityContextFactory.SESSION_ID);
        assertThat(seen.get().correlationId()).isEqualTo("corr-1");
    }

    @Test
    @DisplayName("answers 401 without a bearer token")
    void rejectsMissingToken() throws Exception {
        var request = new MockHttpServletRequest("POST", "/api/simulation/start");
        request.addHeader("Accept-Language", "en-GB,en;q=0.8");
        var response = new MockHttpServletResponse();
        var chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentType()).startsWith("application/problem+json");
        assertThat(response.getContentAsString())
                .contains("auth.missing-token")
                .contains("Authentication required");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    @DisplayName("answers 401 in French for an invalid token by default")
    void rejectsInvalidToken() throws Exception {
        var request = new MockHttpServletRequest("GET", "/api/simulation/history");
        request.addHeader("Authorization", "Bearer not-a-jwt");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("auth.invalid-token");
        assertThat(response.getContentAsString(StandardCharsets.UTF_8)).contains("Jeton invalide");
    }

    @Test
    @DisplayName("rejects a refresh token used as an access token")
    void rejectsRefreshToken() throws Exception {
        String refresh = tokens.issue(TestSecurityContextFactory.professor().user()).refreshToken();
        var request = new MockHttpServletRequest("GET", "/api/simulation/status");
        request.addHeader("Authorization", "Bearer " + refresh);
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("leaves paths outside /api alone")
    void skipsNonApiPaths() throws Exception {
        var request = new MockHttpServletRequest("GET", "/actuator/health");
        var response = new MockHttpServletResponse();
        var chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(chain.getRequest()).isSameAs(request);
    }
}
