package com.brayford.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OrganizationMember + MemberValidator")
class MemberValidatorTest {

    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("founder has no invitation provenance")
        void founder() {
            var member = OrganizationMember.founder("m1", "org-1", "u1", NOW);
            assertThat(member.role()).isEqualTo(OrganizationRole.OWNER);
            assertThat(member.invitedBy()).isNull();
            assertThat(member.invitedAt()).isNull();
            assertThat(member.customPermissions()).isEmpty();
        }

        @Test
        @DisplayName("rejects invitedBy without invitedAt")
        void rejectsHalfProvenance() {
            assertThatThrownBy(() -> new OrganizationMember(
                    "m1", "org-1", "u1", OrganizationRole.MEMBER, null, List.of(), "u0", null, NOW))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("invitedBy and invitedAt");
        }

        @Test
        @DisplayName("copies brand access defensively and defaults null to empty")
        void copiesBrandAccess() {
            var brands = new java.util.ArrayList<>(List.of("b1"));
            var member = OrganizationMember.invited("m1", "org-1", "u1", OrganizationRole.MEMBER,
                    brands, "u0", NOW.minusSeconds(60), NOW);
            brands.add("b2");
            assertThat(member.brandAccess()).containsExactly("b1");
            assertThat(member.withBrandAccess(null).brandAccess()).isEmpty();
        }
    }

    @Nested
    @DisplayName("validate()")
    class Validate {

        @Test
        @DisplayName("accepts a well-formed invited member")
        void acceptsValid() {
            var member = OrganizationMember.invited("m1", "org-1", "u1", OrganizationRole.ADMIN,
                    List.of(), "u0", NOW.minusSeconds(3600), NOW.minusSeconds(60));
            assertThat(MemberValidator.validate(member, NOW).valid()).isTrue();
        }

        @Test
        @DisplayName("reports every problem at once")
        void reportsAll() {
            var member = OrganizationMember.invited(" ", "org-1", "u1", OrganizationRole.MEMBER,
                    List.of(""), "u1", NOW.plusSeconds(7200), NOW.plusSeconds(3600));
            var result = MemberValidator.validate(member, NOW);
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactlyInAnyOrder(
                    "memberId must not be null or blank",
                    "joinedAt must not be in the future",
                    "invitedAt must not be after joinedAt",
                    "a member cannot invite themselves",
                    "brandAccess must not contain blank brand ids");
        }

        @Test
        @DisplayName("joinedAt equal to now is accepted")
        void joinedNow() {
            var member = OrganizationMember.founder("m1", "org-1", "u1", NOW);
            assertThat(MemberValidator.validate(member, NOW).valid()).isTrue();
        }

        @Test
        @DisplayName("orThrow() raises with the joined messages")
        void orThrow() {
            var member = OrganizationMember.founder("m1", "org-1", "u1", NOW.plusSeconds(1));
            assertThatThrownBy(() -> MemberValidator.validate(member, NOW).orThrow())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("joinedAt must not be in the future");
        }
    }
}
