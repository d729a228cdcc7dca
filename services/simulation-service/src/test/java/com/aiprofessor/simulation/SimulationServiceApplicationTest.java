package com.aiprofessor.simulation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.aiprofessor.database.tenant.TenantConnectionCache;
import com.aiprofessor.security.JwtTokenService;
import com.aiprofessor.security.PlatformSecurityContext;
import com.aiprofessor.security.testing.TestSecurityContextFactory;
import com.aiprofessor.simulation.config.ServiceProperties;
import com.aiprofessor.simulation.domain.port.ActivityLogSink;
import com.aiprofessor.simulation.domain.port.SimulationSessionRepository;
import com.aiprofessor.simulation.domain.port.TenantRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Full context with the Mongo-backed ports replaced by mocks, so no database is needed.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Simulation Service Application")
class SimulationServiceApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;
    @Autowired private JwtTokenService tokens;

    @MockBean private SimulationSessionRepository sessions;
    @MockBean private TenantRegistry tenants;
    @MockBean private ActivityLogSink activityLog;

    private String bearer(PlatformSecurityContext caller) {
        String token =
                caller.isSimulation()
                        ? tokens.issueSimulation(caller.user(), caller.simulation()).accessToken()
                        : tokens.issue(caller.user()).accessToken();
        return "Bearer " + token;
    }

    @Test
    @DisplayName("context loads with the test profile")
    void contextLoads() {
        assertThat(context.getBean(ServiceProperties.class).name()).isEqualTo("simulation-service-test");
        assertThat(context.getBean(TenantConnectionCache.class).size()).isZero();
    }

    @Test
    @DisplayName("status answers for an authenticated staff member")
    void statusForStaff() throws Exception {
        mockMvc.perform(
                        get("/api/simulation/status")
                                .header("Authorization", bearer(TestSecurityContextFactory.professor())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.is_simulation").value(false))
                .andExpect(header().exists("X-Correlation-ID"));
    }

    @Test
    @DisplayName("API calls without a token are rejected with 401")
    void missingToken() throws Exception {
        mockMvc.perform(get("/api/simulation/status"))
                .andExpect(status().isUnauthorized())
                .andExpect(content -> assertThat(content.getResponse().getContentAsString()).contains("auth.missing-token"));
    }

    @Test
    @DisplayName("simulation credentials cannot write outside the allow-list")
    void simulationWriteIsBlocked() throws Exception {
        mockMvc.perform(
                        post("/api/simulation/cleanup")
                                .header("Authorization", bearer(TestSecurityContextFactory.simulation())))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("simulation.write-blocked"));
    }

    @Test
    @DisplayName("simulation credentials can end the simulation")
    void simulationCanEnd() throws Exception {
        mockMvc.perform(
                        post("/api/simulation/end")
                                .header("Authorization", bearer(TestSecurityContextFactory.simulation())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("No active simulation session"))
                .andExpect(jsonPath("$.access_token").value(""));
    }

    @Test
    @DisplayName("start validates its body")
    void startValidatesBody() throws Exception {
        mockMvc.perform(
                        post("/api/simulation/start")
                                .header("Authorization", bearer(TestSecurityContextFactory.professor()))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"simulation_mode\":\"READ_ONLY_IMPERSONATION\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("error.validation"));
    }

    @Test
    @DisplayName("students cannot start a simulation")
    void studentsAreForbidden() throws Exception {
        mockMvc.perform(
                        post("/api/simulation/start")
                                .header("Authorization", bearer(TestSecurityContextFactory.student()))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(
                                        "{\"student_id\":\"stu-1\",\"simulation_mode\":\"READ_ONLY_IMPERSONATION\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("simulation.role-not-allowed"));
    }

    @Test
    @DisplayName("actuator health is available without a token")
    void actuatorHealth() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }
}
