package quest.gekko.kolmetrics.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.kolmetrics.domain.Kol;
import quest.gekko.kolmetrics.domain.KolFollowerSnapshot;
import quest.gekko.kolmetrics.domain.Post;
import quest.gekko.kolmetrics.domain.PostMetricSnapshot;
import quest.gekko.kolmetrics.repository.KolFollowerSnapshotRepository;
import quest.gekko.kolmetrics.repository.KolRepository;
import quest.gekko.kolmetrics.repository.PostMetricSnapshotRepository;
import quest.gekko.kolmetrics.repository.PostRepository;
import quest.gekko.kolmetrics.service.integration.provider.ScrapedProfile;
import quest.gekko.kolmetrics.service.integration.provider.ScrapedTweet;
import quest.gekko.kolmetrics.service.integration.provider.TweetMetrics;
import quest.gekko.kolmetrics.util.EngagementMath;
import quest.gekko.kolmetrics.web.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Writes fetched values onto the current-value columns and appends the matching snapshot,
 * both in one transaction per entity. Snapshots are only ever inserted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsSnapshotService {
    private final PostRepository postRepository;
    private final PostMetricSnapshotRepository postSnapshotRepository;
    private final KolRepository kolRepository;
    private final KolFollowerSnapshotRepository followerSnapshotRepository;
    private final Clock clock;

    @Transactional
    public PostMetricSnapshot recordPostMetrics(final Long postId, final ScrapedTweet tweet) {
        final Post post = postRepository.findById(postId)
                .orElseThrow(() -> new ResourceNotFoundException("Post not found"));
        final TweetMetrics m = tweet.metrics();
        final double rate = EngagementMath.engagementRate(m.likes(), m.retweets(), m.replies(), m.quotes(), m.views());
        final Instant capturedAt = captureTime(postSnapshotRepository.findTopByPostIdOrderByCapturedAtDesc(postId)
                .map(PostMetricSnapshot::getCapturedAt));

        post.setImpressions(m.views());
        post.setLikes(m.likes());
        post.setRetweets(m.retweets());
        post.setReplies(m.replies());
        post.setQuotes(m.quotes());
        post.setBookmarks(m.bookmarks());
        post.setEngagementRate(rate);
        post.setLastMetricsUpdate(capturedAt);
        if (post.getTweetId() == null) post.setTweetId(tweet.id());
        if (post.getContent() == null || post.getContent().isBlank()) post.setContent(tweet.content());
        postRepository.save(post);

        final PostMetricSnapshot snapshot = new PostMetricSnapshot();
        snapshot.setPost(post);
        snapshot.setImpressions(m.views());
        snapshot.setLikes(m.likes());
        snapshot.setRetweets(m.retweets());
        snapshot.setReplies(m.replies());
        snapshot.setQuotes(m.quotes());
        snapshot.setBookmarks(m.bookmarks());
        snapshot.setEngagementRate(rate);
        snapshot.setCapturedAt(capturedAt);
        log.debug("Post {}: {} impressions, {}% engagement", postId, m.views(), rate);
        return postSnapshotRepository.save(snapshot);
    }

    /**
     * {@code followersChange} is measured against the newest earlier snapshot, or against the
     * KOL's stored follower count when this is the first one.
     */
    @Transactional
    public KolFollowerSnapshot recordProfile(final Long kolId, final ScrapedProfile profile) {
        final Kol kol = kolRepository.findById(kolId)
                .orElseThrow(() -> new ResourceNotFoundException("KOL not found"));
        final Optional<KolFollowerSnapshot> previous = followerSnapshotRepository.findTopByKolIdOrderByCapturedAtDesc(kolId);
        final long previousFollowers = previous.map(KolFollowerSnapshot::getFollowersCount)
                .orElse(kol.getFollowersCount() == null ? 0L : kol.getFollowersCount());
        final Instant capturedAt = captureTime(previous.map(KolFollowerSnapshot::getCapturedAt));

        kol.setFollowersCount(profile.followersCount());
        kol.setFollowingCount(profile.followingCount());
        if (profile.avatarUrl() != null) kol.setAvatarUrl(profile.avatarUrl());
        if (profile.bannerUrl() != null) kol.setBannerUrl(profile.bannerUrl());
        kol.setLastMetricsUpdate(capturedAt);
        kolRepository.save(kol);

        final KolFollowerSnapshot snapshot = new KolFollowerSnapshot();
        snapshot.setKol(kol);
        snapshot.setFollowersCount(profile.followersCount());
        snapshot.setFollowingCount(profile.followingCount());
        snapshot.setFollowersChange(profile.followersCount() - previousFollowers);
        snapshot.setCapturedAt(capturedAt);
        log.debug("KOL {}: {} followers ({})", kolId, profile.followersCount(), snapshot.getFollowersChange());
        return followerSnapshotRepository.save(snapshot);
    }

    // never earlier than the newest existing snapshot, even if the clock steps back
    private Instant captureTime(final Optional<Instant> newest) {
        final Instant now = clock.instant();
        return newest.filter(last -> last.isAfter(now)).orElse(now);
    }
}
