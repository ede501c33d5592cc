package quest.gekko.kolmetrics.service.credentials;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.kolmetrics.config.KolProperties;
import quest.gekko.kolmetrics.domain.Organization;
import quest.gekko.kolmetrics.repository.OrganizationRepository;
import quest.gekko.kolmetrics.web.exception.ResourceNotFoundException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CredentialContextFactoryTest {

    private static final String KEY = "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";

    @Mock
    private OrganizationRepository organizationRepository;

    private final CredentialCipher cipher = new CredentialCipher(new KolProperties.Crypto(KEY));

    private CredentialContextFactory factory(Long credentialOrganizationId) {
        KolProperties.Refresh refresh = new KolProperties.Refresh(10, 10, 5, Duration.ofSeconds(1),
                Duration.ofMillis(500), Duration.ofDays(30), Duration.ofHours(1), credentialOrganizationId, false,
                "0 0 */6 * * *");
        return new CredentialContextFactory(organizationRepository, cipher, refresh);
    }

    private static Organization org(long id, String socialDataKey, String apifyKey) {
        Organization org = new Organization();
        org.setId(id);
        org.setSocialDataApiKey(socialDataKey);
        org.setApifyApiKey(apifyKey);
        return org;
    }

    @Test
    void forOrganization_decryptsStoredKeys() {
        when(organizationRepository.findById(4L)).thenReturn(Optional.of(org(4L, cipher.encrypt("sd-key"), "legacy-plain")));

        CredentialContext ctx = factory(null).forOrganization(4L);

        assertEquals("sd-key", ctx.socialDataApiKey());
        assertEquals("legacy-plain", ctx.apifyApiKey());
        assertEquals(4L, ctx.organizationId());
    }

    @Test
    void forOrganization_unknownOrganizationIsNotFound() {
        when(organizationRepository.findById(9L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> factory(null).forOrganization(9L));
    }

    @Test
    void forScheduledRun_prefersConfiguredOrganization() {
        when(organizationRepository.findById(2L)).thenReturn(Optional.of(org(2L, null, "ap")));

        CredentialContext ctx = factory(2L).forScheduledRun();

        assertEquals(2L, ctx.organizationId());
        assertEquals("apify", ctx.describeSource());
    }

    @Test
    void forScheduledRun_fallsBackToFirstOrganizationWithAKey() {
        when(organizationRepository.findAllByOrderByIdAsc())
                .thenReturn(List.of(org(1L, null, null), org(2L, "sd", null), org(3L, null, "ap")));

        CredentialContext ctx = factory(null).forScheduledRun();

        assertEquals(2L, ctx.organizationId());
    }

    @Test
    void forScheduledRun_withoutAnyKeyIsUnconfigured() {
        when(organizationRepository.findAllByOrderByIdAsc()).thenReturn(List.of(org(1L, null, null)));

        assertFalse(factory(null).forScheduledRun().hasAnyProviderConfigured());
    }
}
