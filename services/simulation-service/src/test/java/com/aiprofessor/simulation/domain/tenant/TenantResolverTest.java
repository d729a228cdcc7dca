package com.aiprofessor.simulation.domain.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aiprofessor.security.Role;
import com.aiprofessor.security.testing.TestSecurityContextFactory;
import com.aiprofessor.simulation.domain.error.SimulationBadRequestException;
import com.aiprofessor.simulation.domain.error.SimulationForbiddenException;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("TenantResolver")
class TenantResolverTest {

    private final TenantResolver resolver = TenantResolver.standard();

    @Test
    @DisplayName("super admin uses the requested tenant")
    void superAdminUsesRequestedTenant() {
        assertThat(resolver.resolve(TestSecurityContextFactory.superAdmin(), " school-042 "))
                .isEqualTo("school-042");
    }

    @Test
    @DisplayName("super admin without a requested tenant is a bad request")
    void superAdminWithoutTenant() {
        assertThatThrownBy(() -> resolver.resolve(TestSecurityContextFactory.superAdmin(), " "))
                .isInstanceOf(SimulationBadRequestException.class)
                .hasMessage("simulation.tenant-required");
    }

    @ParameterizedTest
    @EnumSource(value = Role.class, names = {"SCHOOL_ADMIN", "PROFESSOR"})
    @DisplayName("school staff always use their own tenant")
    void schoolStaffUseOwnTenant(Role role) {
        var caller = TestSecurityContextFactory.staff(role, "school-001");

        assertThat(resolver.resolve(caller, "school-999")).isEqualTo("school-001");
        assertThat(resolver.resolve(caller, null)).isEqualTo("school-001");
    }

    @Test
    @DisplayName("school staff without a tenant is a bad request")
    void schoolStaffWithoutTenant() {
        var caller = TestSecurityContextFactory.staff(Role.PROFESSOR, null);

        assertThatThrownBy(() -> resolver.resolve(caller, "school-001"))
                .isInstanceOf(SimulationBadRequestException.class)
                .hasMessage("simulation.caller-tenant-missing");
    }

    @Test
    @DisplayName("roles without a strategy are forbidden")
    void studentsAreForbidden() {
        assertThat(resolver.supports(Role.STUDENT)).isFalse();
        assertThatThrownBy(() -> resolver.resolve(TestSecurityContextFactory.student(), "school-001"))
                .isInstanceOf(SimulationForbiddenException.class);
    }

    @Test
    @DisplayName("custom strategies can replace the standard ones")
    void customStrategies() {
        TenantResolver custom =
                new TenantResolver(Map.of(Role.PROFESSOR, (caller, requested) -> "fixed"));

        assertThat(custom.resolve(TestSecurityContextFactory.professor(), null)).isEqualTo("fixed");
        assertThat(custom.supports(Role.SCHOOL_ADMIN)).isFalse();
    }
}
