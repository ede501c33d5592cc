package quest.gekko.kolmetrics.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.kolmetrics.config.KolProperties;
import quest.gekko.kolmetrics.domain.Post;
import quest.gekko.kolmetrics.domain.PostMetricSnapshot;
import quest.gekko.kolmetrics.domain.PostStatus;
import quest.gekko.kolmetrics.repository.CampaignRepository;
import quest.gekko.kolmetrics.repository.PostRepository;
import quest.gekko.kolmetrics.service.credentials.CredentialContext;
import quest.gekko.kolmetrics.service.credentials.CredentialContextFactory;
import quest.gekko.kolmetrics.service.integration.provider.ProviderResult;
import quest.gekko.kolmetrics.service.integration.provider.ScrapedTweet;
import quest.gekko.kolmetrics.web.exception.CooldownActiveException;
import quest.gekko.kolmetrics.web.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PostMetricsService {
    static final List<PostStatus> REFRESHABLE_STATUSES = List.of(PostStatus.POSTED, PostStatus.VERIFIED);
    private static final int MAX_REPORTED_ERRORS = 5;

    private final PostRepository postRepository;
    private final CampaignRepository campaignRepository;
    private final TweetFetchService fetchService;
    private final MetricsSnapshotService snapshotService;
    private final CredentialContextFactory credentialContextFactory;
    private final BatchOrchestrator orchestrator;
    private final KolProperties.Refresh refresh;
    private final Clock clock;

    public record CampaignRefreshResult(int refreshed, int failed, int total, boolean scraperConfigured,
                                        List<String> errors) {}

    /** Manual refresh of one post, at most once per cooldown period. */
    public PostMetricSnapshot refreshPost(final Long organizationId, final Long postId) {
        final Post post = postRepository.findByIdAndCampaignAgencyId(postId, organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("Post not found"));
        if (post.getTweetUrl() == null && post.getTweetId() == null) {
            throw new IllegalArgumentException("Post has no tweet URL");
        }
        final Instant last = post.getLastMetricsUpdate();
        if (last != null) {
            final Duration since = Duration.between(last, clock.instant());
            final Duration remaining = refresh.postCooldown().minus(since);
            if (!remaining.isNegative() && !remaining.isZero()) {
                throw new CooldownActiveException((remaining.toSeconds() + 59) / 60);
            }
        }
        try (CredentialContext credentials = credentialContextFactory.forOrganization(organizationId)) {
            return refreshTarget(credentials, PostTarget.of(post));
        }
    }

    /** POSTED and VERIFIED posts of one campaign, one at a time with a short pause in between. */
    public CampaignRefreshResult refreshCampaign(final Long organizationId, final Long campaignId) {
        campaignRepository.findByIdAndAgencyId(campaignId, organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found"));
        final List<PostTarget> targets = postRepository.findRefreshableByCampaign(campaignId, REFRESHABLE_STATUSES)
                .stream().map(PostTarget::of).toList();

        try (CredentialContext credentials = credentialContextFactory.forOrganization(organizationId)) {
            final BatchResult<PostTarget> result = orchestrator.run("campaign-" + campaignId + "-refresh", targets, 1,
                    refresh.campaignPostDelay(), target -> refreshTarget(credentials, target));
            log.info("Campaign {}: refreshed {}/{} posts", campaignId, result.succeeded(), result.total());
            return new CampaignRefreshResult(result.succeeded(), result.failed(), result.total(),
                    credentials.hasAnyProviderConfigured(), result.sampleErrors(MAX_REPORTED_ERRORS));
        }
    }

    /** Fetch and persist one post; throws when no provider could serve it. */
    PostMetricSnapshot refreshTarget(final CredentialContext credentials, final PostTarget target) {
        final ProviderResult<ScrapedTweet> tweet = fetchService.fetchTweet(credentials, target.tweetUrl());
        if (!tweet.isOk()) throw new ProviderUnavailableException(tweet.reason());
        return snapshotService.recordPostMetrics(target.postId(), tweet.value());
    }
}
