package quest.gekko.kolmetrics.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.kolmetrics.config.KolProperties;
import quest.gekko.kolmetrics.domain.Kol;
import quest.gekko.kolmetrics.domain.KolFollowerSnapshot;
import quest.gekko.kolmetrics.domain.KolStatus;
import quest.gekko.kolmetrics.domain.PostStatus;
import quest.gekko.kolmetrics.repository.KolRepository;
import quest.gekko.kolmetrics.repository.PostAverages;
import quest.gekko.kolmetrics.repository.PostRepository;
import quest.gekko.kolmetrics.service.credentials.CredentialContext;
import quest.gekko.kolmetrics.service.credentials.CredentialContextFactory;
import quest.gekko.kolmetrics.service.integration.provider.ProviderResult;
import quest.gekko.kolmetrics.service.integration.provider.ScrapedProfile;
import quest.gekko.kolmetrics.util.EngagementMath;
import quest.gekko.kolmetrics.web.exception.ResourceNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Ad hoc KOL refreshes: profile fetch plus engagement averages from the KOL's own posts. */
@Slf4j
@Service
@RequiredArgsConstructor
public class KolMetricsService {
    static final List<PostStatus> COUNTED_STATUSES = List.of(PostStatus.POSTED, PostStatus.VERIFIED);

    private final KolRepository kolRepository;
    private final PostRepository postRepository;
    private final TweetFetchService fetchService;
    private final MetricsSnapshotService snapshotService;
    private final CredentialContextFactory credentialContextFactory;
    private final BatchOrchestrator orchestrator;
    private final KolProperties.Refresh refresh;

    public record RefreshAllResult(int total, int updated, int failed, List<KolRefreshOutcome> results) {}

    public KolRefreshOutcome refreshKol(final Long organizationId, final Long kolId) {
        final Kol kol = kolRepository.findByIdAndOrganizationId(kolId, organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("KOL not found"));
        try (CredentialContext credentials = credentialContextFactory.forOrganization(organizationId)) {
            return refreshKol(credentials, kol.getId(), kol.getTwitterHandle());
        }
    }

    public RefreshAllResult refreshAll(final Long organizationId) {
        final List<Kol> kols = kolRepository.findByOrganizationIdAndStatusIn(organizationId,
                List.of(KolStatus.ACTIVE, KolStatus.PENDING));
        final Map<Long, KolRefreshOutcome> outcomes = new ConcurrentHashMap<>();

        final BatchResult<Kol> result;
        try (CredentialContext credentials = credentialContextFactory.forOrganization(organizationId)) {
            result = orchestrator.run("refresh-all-kols", kols, refresh.refreshAllBatchSize(), refresh.batchDelay(),
                    kol -> {
                        final KolRefreshOutcome outcome = refreshKol(credentials, kol.getId(), kol.getTwitterHandle());
                        outcomes.put(kol.getId(), outcome);
                        if (outcome.error() != null) throw new ProviderUnavailableException(outcome.error());
                    });
        }
        final List<KolRefreshOutcome> ordered = kols.stream()
                .map(k -> outcomes.getOrDefault(k.getId(), failedOutcome(k)))
                .toList();
        log.info("Refreshed {}/{} KOLs of organization {}", result.succeeded(), result.total(), organizationId);
        return new RefreshAllResult(result.total(), result.succeeded(), result.failed(), ordered);
    }

    /**
     * Refreshes the profile when the handle resolves, then recomputes averages regardless.
     * {@code error} is set when the profile could not be fetched.
     */
    KolRefreshOutcome refreshKol(final CredentialContext credentials, final Long kolId, final String handle) {
        Long followers = null;
        Long change = null;
        String error = null;
        if (handle == null || handle.isBlank()) {
            error = "KOL has no Twitter handle";
        } else if (!credentials.hasAnyProviderConfigured()) {
            error = "No API key configured";
        } else {
            final ProviderResult<ScrapedProfile> profile = fetchService.fetchProfile(credentials, handle);
            if (profile.isOk()) {
                final KolFollowerSnapshot snapshot = snapshotService.recordProfile(kolId, profile.value());
                followers = snapshot.getFollowersCount();
                change = snapshot.getFollowersChange();
            } else {
                error = profile.reason();
            }
        }
        return recomputeAverages(kolId, handle, followers, change, error);
    }

    private KolRefreshOutcome recomputeAverages(final Long kolId, final String handle, final Long followers,
                                               final Long change, final String error) {
        final Kol kol = kolRepository.findById(kolId)
                .orElseThrow(() -> new ResourceNotFoundException("KOL not found"));
        final PostAverages averages = postRepository.averagesForKol(kolId, COUNTED_STATUSES);
        final long avgLikes = Math.round(orZero(averages.likes()));
        final long avgRetweets = Math.round(orZero(averages.retweets()));
        final long avgReplies = Math.round(orZero(averages.replies()));
        final double avgImpressions = orZero(averages.impressions());
        final long knownFollowers = followers != null ? followers
                : kol.getFollowersCount() != null && kol.getFollowersCount() > 0 ? kol.getFollowersCount() : 1L;

        final double interactions = avgLikes + avgRetweets + avgReplies;
        final double denominator = avgImpressions > 0 ? avgImpressions : knownFollowers;
        final double rate = EngagementMath.round2(interactions / denominator * 100);

        kol.setAvgLikes(avgLikes);
        kol.setAvgRetweets(avgRetweets);
        kol.setAvgReplies(avgReplies);
        kol.setAvgEngagementRate(rate);
        kolRepository.save(kol);

        final long posts = averages.postCount() == null ? 0 : averages.postCount();
        return new KolRefreshOutcome(kolId, handle, followers != null, followers, change,
                avgLikes, avgRetweets, avgReplies, rate, posts, error);
    }

    private static KolRefreshOutcome failedOutcome(final Kol kol) {
        return new KolRefreshOutcome(kol.getId(), kol.getTwitterHandle(), false, null, null, 0, 0, 0, 0, 0, "not processed");
    }

    private static double orZero(final Double value) {
        return value == null ? 0.0 : value;
    }
}
