package quest.gekko.kolmetrics.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.kolmetrics.domain.Campaign;
import quest.gekko.kolmetrics.repository.CampaignRepository;
import quest.gekko.kolmetrics.service.credentials.CredentialContext;
import quest.gekko.kolmetrics.service.credentials.CredentialContextFactory;
import quest.gekko.kolmetrics.service.integration.provider.ProfileMedia;
import quest.gekko.kolmetrics.util.TweetIdentifiers;
import quest.gekko.kolmetrics.web.dto.MediaRefreshResult;

import java.util.ArrayList;
import java.util.List;

/** Fills in the project avatar and banner of an agency's campaigns from their Twitter handle. */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignMediaService {
    private final CampaignRepository campaignRepository;
    private final TweetFetchService fetchService;
    private final CredentialContextFactory credentialContextFactory;

    /** Without {@code force} only campaigns missing an avatar or a banner are looked up. */
    public MediaRefreshResult refreshMedia(final Long organizationId, final boolean force) {
        final List<Campaign> campaigns = campaignRepository.findByAgencyIdAndProjectTwitterHandleIsNotNull(organizationId)
                .stream()
                .filter(c -> !c.getProjectTwitterHandle().isBlank())
                .filter(c -> force || isBlank(c.getProjectAvatarUrl()) || isBlank(c.getProjectBannerUrl()))
                .toList();
        log.info("Refreshing media for {} campaigns of organization {} (force={})", campaigns.size(), organizationId, force);

        int updated = 0;
        final List<MediaRefreshResult.CampaignMedia> results = new ArrayList<>();
        try (CredentialContext credentials = credentialContextFactory.forOrganization(organizationId)) {
            for (Campaign campaign : campaigns) {
                final String handle = TweetIdentifiers.cleanHandle(campaign.getProjectTwitterHandle());
                try {
                    final ProfileMedia media = fetchService.fetchAvatarAndBanner(credentials, handle);
                    if (media.isEmpty()) {
                        results.add(new MediaRefreshResult.CampaignMedia(campaign.getId(), handle, null, null, "No media found"));
                        continue;
                    }
                    if (media.avatarUrl() != null) campaign.setProjectAvatarUrl(media.avatarUrl());
                    if (media.bannerUrl() != null) campaign.setProjectBannerUrl(media.bannerUrl());
                    campaignRepository.save(campaign);
                    updated++;
                    results.add(new MediaRefreshResult.CampaignMedia(campaign.getId(), handle,
                            media.avatarUrl(), media.bannerUrl(), null));
                } catch (RuntimeException e) {
                    log.warn("Media refresh for campaign {} (@{}) failed: {}", campaign.getId(), handle, e.getMessage());
                    results.add(new MediaRefreshResult.CampaignMedia(campaign.getId(), handle, null, null, e.getMessage()));
                }
            }
        }
        return new MediaRefreshResult(campaigns.size(), updated, campaigns.size() - updated, results);
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }
}
