package quest.gekko.kolmetrics.web.security;

import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import quest.gekko.kolmetrics.domain.OrganizationType;
import quest.gekko.kolmetrics.web.exception.TenantAccessException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TenantSessionResolverTest {

    private final TenantSessionResolver resolver = new TenantSessionResolver();

    private static final TenantSession AGENCY = new TenantSession(10L, OrganizationType.AGENCY, false, "ana");
    private static final TenantSession CLIENT = new TenantSession(20L, OrganizationType.CLIENT, false, "cleo");
    private static final TenantSession CLIENT_ADMIN = new TenantSession(20L, OrganizationType.CLIENT, true, "root");

    @Test
    void resolve_acceptsSessionDirectlyOrInsideAuthentication() {
        assertSame(AGENCY, resolver.resolve(AGENCY));
        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(AGENCY, null, List.of());
        assertSame(AGENCY, resolver.resolve(auth));
    }

    @Test
    void resolve_withoutUsableSessionIsUnauthenticated() {
        assertFalse(assertThrows(TenantAccessException.class, () -> resolver.resolve(null)).isAuthenticated());
        assertThrows(TenantAccessException.class,
                () -> resolver.resolve(new TestingAuthenticationToken("plain-user", "pw")));
        assertThrows(TenantAccessException.class,
                () -> resolver.resolve(new TenantSession(null, OrganizationType.AGENCY, false, "ghost")));
    }

    @Test
    void requireAgency_rejectsClientOrganizations() {
        assertEquals(10L, resolver.requireAgency(AGENCY).organizationId());
        TenantAccessException ex = assertThrows(TenantAccessException.class, () -> resolver.requireAgency(CLIENT));
        assertTrue(ex.isAuthenticated());
        assertThrows(TenantAccessException.class, () -> resolver.requireAgency(CLIENT_ADMIN));
    }

    @Test
    void requireAgencyOrAdmin_letsAdminsThrough() {
        assertSame(CLIENT_ADMIN, resolver.requireAgencyOrAdmin(CLIENT_ADMIN));
        assertSame(AGENCY, resolver.requireAgencyOrAdmin(AGENCY));
        assertThrows(TenantAccessException.class, () -> resolver.requireAgencyOrAdmin(CLIENT));
    }
}
