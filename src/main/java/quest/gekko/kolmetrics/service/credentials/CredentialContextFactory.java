package quest.gekko.kolmetrics.service.credentials;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.kolmetrics.config.KolProperties;
import quest.gekko.kolmetrics.domain.Organization;
import quest.gekko.kolmetrics.repository.OrganizationRepository;
import quest.gekko.kolmetrics.web.exception.ResourceNotFoundException;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialContextFactory {
    private final OrganizationRepository organizationRepository;
    private final CredentialCipher cipher;
    private final KolProperties.Refresh refresh;

    @Transactional(readOnly = true)
    public CredentialContext forOrganization(final Long organizationId) {
        final Organization org = organizationRepository.findById(organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("Organization not found"));
        final CredentialContext context = decrypt(org);
        log.debug("Loaded credentials for organization {}: {}", organizationId, context.describeSource());
        return context;
    }

    /**
     * Credentials for an unattended run: the configured organization when one is set,
     * otherwise the first organization holding a primary or secondary key.
     */
    @Transactional(readOnly = true)
    public CredentialContext forScheduledRun() {
        final Long configured = refresh.credentialOrganizationId();
        if (configured != null) {
            final Optional<Organization> org = organizationRepository.findById(configured);
            if (org.isPresent()) {
                return decrypt(org.get());
            }
            log.warn("kol.refresh.credential-organization-id={} does not exist, falling back to first configured organization",
                    configured);
        }

        for (Organization org : organizationRepository.findAllByOrderByIdAsc()) {
            final CredentialContext context = decrypt(org);
            if (context.hasAnyProviderConfigured()) {
                log.info("Scheduled run uses credentials of organization {} ({})", org.getId(), context.describeSource());
                return context;
            }
            context.close();
        }
        log.warn("No organization has provider credentials configured");
        return CredentialContext.unconfigured();
    }

    private CredentialContext decrypt(final Organization org) {
        return CredentialContext.builder()
                .organizationId(org.getId())
                .socialDataApiKey(cipher.safeDecrypt(org.getSocialDataApiKey()))
                .apifyApiKey(cipher.safeDecrypt(org.getApifyApiKey()))
                .twitterApiKey(cipher.safeDecrypt(org.getTwitterApiKey()))
                .twitterCookies(cipher.safeDecrypt(org.getTwitterCookies()))
                .twitterCsrfToken(cipher.safeDecrypt(org.getTwitterCsrfToken()))
                .build();
    }
}
