package com.brayford.security;

import com.brayford.security.testing.TestMemberFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TenantIsolationEnforcer")
class TenantIsolationEnforcerTest {

    @Test
    @DisplayName("passes when the member belongs to the organization")
    void sameOrganization() {
        var member = TestMemberFactory.create("u1", "org-a", OrganizationRole.MEMBER, List.of());
        assertThatCode(() -> TenantIsolationEnforcer.enforce(member, "org-a")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("throws TenantMismatchException carrying both organization ids")
    void differentOrganization() {
        var member = TestMemberFactory.create("u1", "org-a", OrganizationRole.OWNER, List.of());
        assertThatThrownBy(() -> TenantIsolationEnforcer.enforce(member, "org-b"))
                .isInstanceOfSatisfying(TenantMismatchException.class, e -> {
                    assertThat(e.expectedOrganizationId()).isEqualTo("org-b");
                    assertThat(e.actualOrganizationId()).isEqualTo("org-a");
                });
    }

    @Test
    @DisplayName("sameTenant() compares organization ids")
    void sameTenant() {
        var a = TestMemberFactory.create("u1", "org-a", OrganizationRole.OWNER, List.of());
        var b = TestMemberFactory.create("u2", "org-a", OrganizationRole.MEMBER, List.of());
        var c = TestMemberFactory.create("u3", "org-c", OrganizationRole.MEMBER, List.of());
        assertThat(TenantIsolationEnforcer.sameTenant(a, b)).isTrue();
        assertThat(TenantIsolationEnforcer.sameTenant(a, c)).isFalse();
    }
}
