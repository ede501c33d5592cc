package quest.gekko.kolmetrics.web.security;

import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import quest.gekko.kolmetrics.web.exception.TenantAccessException;

import java.security.Principal;

/**
 * Extracts the {@link TenantSession} from the request principal. The session is either the
 * principal itself or the principal of a Spring Security {@link Authentication}.
 */
@Component
public class TenantSessionResolver {

    public TenantSession resolve(final Principal principal) {
        if (principal instanceof TenantSession session) return checked(session);
        if (principal instanceof Authentication auth && auth.isAuthenticated()
                && auth.getPrincipal() instanceof TenantSession session) {
            return checked(session);
        }
        throw TenantAccessException.unauthenticated();
    }

    public TenantSession requireAgency(final Principal principal) {
        final TenantSession session = resolve(principal);
        if (!session.isAgency()) throw TenantAccessException.forbidden("Forbidden");
        return session;
    }

    /** Agency members, or platform admins of any organization. */
    public TenantSession requireAgencyOrAdmin(final Principal principal) {
        final TenantSession session = resolve(principal);
        if (!session.isAgency() && !session.admin()) throw TenantAccessException.forbidden("Forbidden");
        return session;
    }

    private static TenantSession checked(final TenantSession session) {
        if (session.organizationId() == null) throw TenantAccessException.unauthenticated();
        return session;
    }
}
