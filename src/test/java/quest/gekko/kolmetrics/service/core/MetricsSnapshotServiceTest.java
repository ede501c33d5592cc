package quest.gekko.kolmetrics.service.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
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

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricsSnapshotServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private PostRepository postRepository;

    @Mock
    private PostMetricSnapshotRepository postSnapshotRepository;

    @Mock
    private KolRepository kolRepository;

    @Mock
    private KolFollowerSnapshotRepository followerSnapshotRepository;

    private MetricsSnapshotService service;

    @BeforeEach
    void setUp() {
        service = new MetricsSnapshotService(postRepository, postSnapshotRepository, kolRepository,
                followerSnapshotRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void recordPostMetrics_updatesCurrentValuesAndAppendsSnapshot() {
        Post post = new Post();
        post.setId(5L);
        post.setTweetUrl("https://x.com/alice/status/1");
        when(postRepository.findById(5L)).thenReturn(Optional.of(post));
        when(postSnapshotRepository.findTopByPostIdOrderByCapturedAtDesc(5L)).thenReturn(Optional.empty());
        when(postSnapshotRepository.save(any(PostMetricSnapshot.class))).thenAnswer(inv -> inv.getArgument(0));
        ScrapedTweet tweet = new ScrapedTweet("1", "https://x.com/alice/status/1", "gm", "alice", "Alice", NOW,
                false, false, new TweetMetrics(2000, 30, 6, 3, 1, 4), List.of());

        PostMetricSnapshot snapshot = service.recordPostMetrics(5L, tweet);

        assertEquals(2000L, post.getImpressions());
        assertEquals(30L, post.getLikes());
        assertEquals(2.0, post.getEngagementRate());
        assertEquals("1", post.getTweetId());
        assertEquals("gm", post.getContent());
        assertEquals(NOW, post.getLastMetricsUpdate());
        assertSame(post, snapshot.getPost());
        assertEquals(2.0, snapshot.getEngagementRate());
        assertEquals(NOW, snapshot.getCapturedAt());
    }

    @Test
    void recordPostMetrics_captureTimeNeverGoesBackwards() {
        Instant later = NOW.plusSeconds(60);
        PostMetricSnapshot previous = new PostMetricSnapshot();
        previous.setCapturedAt(later);
        Post post = new Post();
        post.setId(5L);
        when(postRepository.findById(5L)).thenReturn(Optional.of(post));
        when(postSnapshotRepository.findTopByPostIdOrderByCapturedAtDesc(5L)).thenReturn(Optional.of(previous));
        when(postSnapshotRepository.save(any(PostMetricSnapshot.class))).thenAnswer(inv -> inv.getArgument(0));

        PostMetricSnapshot snapshot = service.recordPostMetrics(5L, FakeProvider.tweet("1", "alice", "gm"));

        assertEquals(later, snapshot.getCapturedAt());
    }

    @Test
    void recordProfile_followerChangeAgainstPreviousSnapshotCanBeNegative() {
        Kol kol = new Kol();
        kol.setId(3L);
        kol.setFollowersCount(1000L);
        KolFollowerSnapshot previous = new KolFollowerSnapshot();
        previous.setFollowersCount(1200L);
        previous.setCapturedAt(NOW.minusSeconds(3600));
        when(kolRepository.findById(3L)).thenReturn(Optional.of(kol));
        when(followerSnapshotRepository.findTopByKolIdOrderByCapturedAtDesc(3L)).thenReturn(Optional.of(previous));
        when(followerSnapshotRepository.save(any(KolFollowerSnapshot.class))).thenAnswer(inv -> inv.getArgument(0));

        KolFollowerSnapshot snapshot = service.recordProfile(3L,
                new ScrapedProfile("alice", "Alice", 1150, 80, "https://img/a.png", null));

        assertEquals(-50L, snapshot.getFollowersChange());
        assertEquals(1150L, kol.getFollowersCount());
        assertEquals("https://img/a.png", kol.getAvatarUrl());
        assertEquals(NOW, kol.getLastMetricsUpdate());
    }

    @Test
    void recordProfile_firstSnapshotComparesWithStoredCount() {
        Kol kol = new Kol();
        kol.setId(3L);
        kol.setFollowersCount(1000L);
        kol.setBannerUrl("https://img/old-banner");
        when(kolRepository.findById(3L)).thenReturn(Optional.of(kol));
        when(followerSnapshotRepository.findTopByKolIdOrderByCapturedAtDesc(3L)).thenReturn(Optional.empty());
        when(followerSnapshotRepository.save(any(KolFollowerSnapshot.class))).thenAnswer(inv -> inv.getArgument(0));

        KolFollowerSnapshot snapshot = service.recordProfile(3L,
                new ScrapedProfile("alice", "Alice", 1100, 80, null, null));

        assertEquals(100L, snapshot.getFollowersChange());
        assertEquals("https://img/old-banner", kol.getBannerUrl());
    }
}
