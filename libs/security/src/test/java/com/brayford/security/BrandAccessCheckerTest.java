package com.brayford.security;

import com.brayford.security.testing.TestMemberFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BrandAccessChecker")
class BrandAccessCheckerTest {

    @Test
    @DisplayName("owner and admin reach any brand with an empty list")
    void implicitAccess() {
        assertThat(BrandAccessChecker.hasBrandAccess(TestMemberFactory.owner(), "brand-1")).isTrue();
        assertThat(BrandAccessChecker.hasBrandAccess(TestMemberFactory.admin(), "brand-9")).isTrue();
    }

    @Test
    @DisplayName("member with an empty list reaches no brand")
    void emptyListMeansNothing() {
        var member = TestMemberFactory.member();
        for (String brand : new String[] {"brand-1", "brand-2", "", "*"}) {
            assertThat(BrandAccessChecker.hasBrandAccess(member, brand)).as(brand).isFalse();
        }
    }

    @Test
    @DisplayName("member reaches exactly the listed brands")
    void listedBrandsOnly() {
        var member = TestMemberFactory.member("brand-1", "brand-3");
        assertThat(BrandAccessChecker.hasBrandAccess(member, "brand-1")).isTrue();
        assertThat(BrandAccessChecker.hasBrandAccess(member, "brand-3")).isTrue();
        assertThat(BrandAccessChecker.hasBrandAccess(member, "brand-2")).isFalse();
    }

    @Test
    @DisplayName("requireBrandAccess throws AccessDeniedException with role and brand")
    void requireThrows() {
        var member = TestMemberFactory.member("brand-1");
        assertThatCode(() -> BrandAccessChecker.requireBrandAccess(member, "brand-1")).doesNotThrowAnyException();
        assertThatThrownBy(() -> BrandAccessChecker.requireBrandAccess(member, "brand-2"))
                .isInstanceOfSatisfying(AccessDeniedException.class, e -> {
                    assertThat(e.role()).isEqualTo(OrganizationRole.MEMBER);
                    assertThat(e.brandId()).isEqualTo("brand-2");
                })
                .hasMessage("Access denied: member does not have access to brand brand-2");
    }
}
