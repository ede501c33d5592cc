package quest.gekko.kolmetrics.web.security;

import quest.gekko.kolmetrics.domain.OrganizationType;

import java.security.Principal;

/** The authenticated caller as the pipeline sees it: which organization, of what kind. */
public record TenantSession(Long organizationId, OrganizationType organizationType, boolean admin, String username)
        implements Principal {

    @Override
    public String getName() {
        return username;
    }

    public boolean isAgency() {
        return organizationType == OrganizationType.AGENCY;
    }
}
