package quest.gekko.kolmetrics.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import quest.gekko.kolmetrics.config.KolProperties;
import quest.gekko.kolmetrics.domain.Campaign;
import quest.gekko.kolmetrics.domain.Kol;
import quest.gekko.kolmetrics.repository.CampaignRepository;
import quest.gekko.kolmetrics.repository.PostRepository;
import quest.gekko.kolmetrics.service.credentials.CredentialContext;
import quest.gekko.kolmetrics.service.credentials.CredentialContextFactory;
import quest.gekko.kolmetrics.service.integration.provider.ProviderResult;
import quest.gekko.kolmetrics.service.integration.provider.ScrapedTweet;
import quest.gekko.kolmetrics.util.MalformedTweetIdentifierException;
import quest.gekko.kolmetrics.util.TweetIdentifiers;
import quest.gekko.kolmetrics.web.dto.AnnotatedTweet;
import quest.gekko.kolmetrics.web.dto.KolScrapeResult;
import quest.gekko.kolmetrics.web.dto.KolSummary;
import quest.gekko.kolmetrics.web.dto.ScrapeInfo;
import quest.gekko.kolmetrics.web.dto.ScrapeRequest;
import quest.gekko.kolmetrics.web.dto.ScrapeResponse;
import quest.gekko.kolmetrics.web.exception.ResourceNotFoundException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Finds campaign content either from explicit tweet URLs or by searching the campaign's KOLs,
 * drops tweets the campaign already tracks, tags keyword hits and optionally imports the rest
 * as POSTED posts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignScrapeService {
    private static final String MANUAL_IMPORT = "Manual Import";

    private final CampaignRepository campaignRepository;
    private final PostRepository postRepository;
    private final TweetFetchService fetchService;
    private final PostImportWriter importWriter;
    private final CredentialContextFactory credentialContextFactory;
    private final KolProperties.Scrape scrape;

    private record Found(ScrapedTweet tweet, KolSummary kol) {}

    public ScrapeInfo info(final Long organizationId, final Long campaignId) {
        final Campaign campaign = campaignRepository.findWithKolsVisibleTo(campaignId, organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found"));
        return new ScrapeInfo(campaign.getId(), List.copyOf(campaign.getKeywords()), summaries(campaign.getKols()), true);
    }

    public ScrapeResponse scrape(final Long organizationId, final Long campaignId, final ScrapeRequest request) {
        final Campaign campaign = campaignRepository.findWithKolsByIdAndAgencyId(campaignId, organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found"));
        final List<String> campaignKeywords = List.copyOf(campaign.getKeywords());
        final List<KolSummary> campaignKols = summaries(campaign.getKols());
        final Set<String> seen = existingTweetIds(campaignId);

        try (CredentialContext credentials = credentialContextFactory.forOrganization(organizationId)) {
            final List<KolScrapeResult> results = new ArrayList<>();
            final List<Found> found = request.manual()
                    ? fetchManual(credentials, request.tweetUrls(), campaignKols, results)
                    : searchKols(credentials, request, campaignKols, campaignKeywords, results);

            final List<Found> fresh = new ArrayList<>();
            for (Found f : found) {
                if (seen.add(f.tweet().id())) fresh.add(f);
            }
            log.info("Campaign {}: scraped {} tweets, {} not yet tracked", campaignId, found.size(), fresh.size());

            final List<AnnotatedTweet> annotated = fresh.stream()
                    .map(f -> AnnotatedTweet.of(f.tweet(), f.kol(), matchKeywords(f.tweet().content(), campaignKeywords)))
                    .toList();

            int imported = 0;
            String importError = null;
            if (request.shouldImport()) {
                for (int i = 0; i < annotated.size(); i++) {
                    final AnnotatedTweet tweet = annotated.get(i);
                    if (tweet.kolId() == null) continue;
                    try {
                        if (importWriter.insert(campaignId, tweet.kolId(), fresh.get(i).tweet(), tweet.matchedKeywords())) {
                            imported++;
                        }
                    } catch (DataIntegrityViolationException e) {
                        log.debug("Tweet {} was imported concurrently, skipping", tweet.id());
                    } catch (RuntimeException e) {
                        log.error("Auto-import for campaign {} stopped after {} posts", campaignId, imported, e);
                        importError = "Import failed after " + imported + " posts: " + e.getMessage();
                        break;
                    }
                }
                log.info("Campaign {}: imported {} posts", campaignId, imported);
            }

            return new ScrapeResponse(importError == null, results, annotated, found.size(), imported,
                    campaignKeywords,
                    new ScrapeResponse.Debug(credentials.hasAnyProviderConfigured(), credentials.describeSource()),
                    importError);
        }
    }

    private List<Found> fetchManual(final CredentialContext credentials, final List<String> tweetUrls,
                                    final List<KolSummary> kols, final List<KolScrapeResult> results) {
        final Map<String, KolSummary> byHandle = byHandle(kols);
        final List<Found> found = new ArrayList<>();
        final List<String> errors = new ArrayList<>();
        for (String url : tweetUrls) {
            try {
                final ProviderResult<ScrapedTweet> tweet = fetchService.fetchTweet(credentials, url);
                if (tweet.isOk()) {
                    found.add(new Found(tweet.value(), byHandle.get(tweet.value().authorHandle().toLowerCase(Locale.ROOT))));
                } else {
                    errors.add(tweet.reason());
                }
            } catch (MalformedTweetIdentifierException e) {
                errors.add(e.getMessage());
            }
        }
        results.add(new KolScrapeResult(MANUAL_IMPORT, null, !found.isEmpty(), found.size(),
                errors.isEmpty() ? null : String.join("; ", errors)));
        return found;
    }

    private List<Found> searchKols(final CredentialContext credentials, final ScrapeRequest request,
                                   final List<KolSummary> campaignKols, final List<String> campaignKeywords,
                                   final List<KolScrapeResult> results) {
        final List<KolSummary> targets = campaignKols.stream()
                .filter(k -> request.kolIds() == null || request.kolIds().isEmpty() || request.kolIds().contains(k.id()))
                .filter(k -> k.handle() != null && !k.handle().isBlank())
                .toList();
        if (targets.isEmpty()) throw new IllegalArgumentException("No KOLs to scrape");

        final List<String> keywords = request.filterKeywords() != null && !request.filterKeywords().isEmpty()
                ? request.filterKeywords() : campaignKeywords;
        final Map<String, KolSearchResult> byHandle = fetchService.scrapeMultipleKols(credentials,
                targets.stream().map(KolSummary::handle).toList(), keywords, scrape.maxTweetsPerKol());

        final List<Found> found = new ArrayList<>();
        for (KolSummary kol : targets) {
            final KolSearchResult result = byHandle.get(TweetIdentifiers.cleanHandle(kol.handle()).toLowerCase(Locale.ROOT));
            if (result == null) continue;
            results.add(new KolScrapeResult(kol.name() + " (@" + TweetIdentifiers.cleanHandle(kol.handle()) + ")",
                    kol.id(), result.success(), result.tweets().size(), result.error()));
            result.tweets().forEach(t -> found.add(new Found(t, kol)));
        }
        return found;
    }

    /** Ids of tweets the campaign already has, taken from stored ids and from tweet URLs. */
    private Set<String> existingTweetIds(final Long campaignId) {
        final Set<String> ids = new HashSet<>(postRepository.findTweetIdsByCampaignId(campaignId));
        for (String url : postRepository.findTweetUrlsByCampaignId(campaignId)) {
            ids.add(TweetIdentifiers.canonicalId(url).orElse(url));
        }
        return ids;
    }

    static List<String> matchKeywords(final String content, final List<String> keywords) {
        if (content == null || keywords == null || keywords.isEmpty()) return List.of();
        final String lower = content.toLowerCase(Locale.ROOT);
        return keywords.stream()
                .filter(k -> k != null && !k.isBlank() && lower.contains(k.toLowerCase(Locale.ROOT)))
                .toList();
    }

    private static List<KolSummary> summaries(final Set<Kol> kols) {
        return kols.stream()
                .map(k -> new KolSummary(k.getId(), k.getName(), k.getTwitterHandle()))
                .toList();
    }

    private static Map<String, KolSummary> byHandle(final List<KolSummary> kols) {
        return kols.stream()
                .filter(k -> k.handle() != null && !k.handle().isBlank())
                .collect(Collectors.toMap(k -> TweetIdentifiers.cleanHandle(k.handle()).toLowerCase(Locale.ROOT),
                        Function.identity(), (a, b) -> a));
    }
}
