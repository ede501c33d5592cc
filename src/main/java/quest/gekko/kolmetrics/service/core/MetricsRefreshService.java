package quest.gekko.kolmetrics.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.kolmetrics.config.KolProperties;
import quest.gekko.kolmetrics.domain.KolStatus;
import quest.gekko.kolmetrics.repository.KolRepository;
import quest.gekko.kolmetrics.repository.PostRepository;
import quest.gekko.kolmetrics.service.credentials.CredentialContext;
import quest.gekko.kolmetrics.service.credentials.CredentialContextFactory;
import quest.gekko.kolmetrics.service.integration.provider.ProviderResult;
import quest.gekko.kolmetrics.service.integration.provider.ScrapedProfile;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The unattended refresh: recent POSTED/VERIFIED posts first, then ACTIVE KOLs with a handle.
 * One organization's credentials drive the whole run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsRefreshService {
    private static final int MAX_REPORTED_ERRORS = 5;

    private final PostRepository postRepository;
    private final KolRepository kolRepository;
    private final PostMetricsService postMetricsService;
    private final TweetFetchService fetchService;
    private final MetricsSnapshotService snapshotService;
    private final CredentialContextFactory credentialContextFactory;
    private final BatchOrchestrator orchestrator;
    private final KolProperties.Refresh refresh;
    private final Clock clock;

    private final ReentrantLock running = new ReentrantLock();

    public RefreshSummary runScheduledRefresh() {
        if (!running.tryLock()) {
            log.warn("Metrics refresh already in progress, ignoring trigger");
            return RefreshSummary.alreadyRunning();
        }
        try (CredentialContext credentials = credentialContextFactory.forScheduledRun()) {
            return refreshAll(credentials);
        } finally {
            running.unlock();
        }
    }

    private RefreshSummary refreshAll(final CredentialContext credentials) {
        final Instant since = clock.instant().minus(refresh.postWindow());
        final String source = credentials.describeSource();
        log.info("Metrics refresh started (credentials: {}, posts since {})", source, since);

        final List<PostTarget> posts = postRepository.findDueForRefresh(PostMetricsService.REFRESHABLE_STATUSES, since)
                .stream().map(PostTarget::of).toList();
        // the syndication fallback needs no key, so posts are attempted even without credentials
        final BatchResult<PostTarget> postResult = orchestrator.run("post-refresh", posts,
                refresh.postBatchSize(), refresh.batchDelay(),
                target -> postMetricsService.refreshTarget(credentials, target));

        final List<KolTarget> kols = kolRepository.findWithHandleByStatus(KolStatus.ACTIVE)
                .stream().map(KolTarget::of).toList();
        final RefreshSummary.Counts kolCounts;
        final List<String> errors = new ArrayList<>(postResult.sampleErrors(MAX_REPORTED_ERRORS));
        if (!credentials.hasAnyProviderConfigured()) {
            log.warn("No provider credentials configured, skipping profile refresh for {} KOLs", kols.size());
            kolCounts = RefreshSummary.Counts.skipped(kols.size());
        } else {
            final BatchResult<KolTarget> kolResult = orchestrator.run("kol-refresh", kols,
                    refresh.kolBatchSize(), refresh.batchDelay(), target -> refreshProfile(credentials, target));
            kolCounts = RefreshSummary.Counts.of(kolResult);
            kolResult.sampleErrors(MAX_REPORTED_ERRORS - Math.min(errors.size(), MAX_REPORTED_ERRORS))
                    .forEach(errors::add);
        }

        final RefreshSummary summary = new RefreshSummary("completed", RefreshSummary.Counts.of(postResult), kolCounts,
                source, errors);
        log.info("Metrics refresh finished: posts {}/{} ok, kols {}/{} ok", postResult.succeeded(), postResult.total(),
                kolCounts.success(), kolCounts.total());
        return summary;
    }

    private void refreshProfile(final CredentialContext credentials, final KolTarget target) {
        final ProviderResult<ScrapedProfile> profile = fetchService.fetchProfile(credentials, target.handle());
        if (!profile.isOk()) throw new ProviderUnavailableException(profile.reason());
        snapshotService.recordProfile(target.kolId(), profile.value());
    }
}
