package quest.gekko.kolmetrics.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A KOL's tweet tracked for a campaign. Metric columns hold the latest known
 * values; history lives in {@link PostMetricSnapshot}.
 */
@Entity
@Table(name = "post", uniqueConstraints = @UniqueConstraint(columnNames = { "campaign_id", "tweet_id" }))
@Getter @Setter
public class Post {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id", nullable = false)
    Campaign campaign;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "kol_id", nullable = false)
    Kol kol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    PostType type = PostType.POST;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    PostStatus status = PostStatus.DRAFT;

    @Column(columnDefinition = "text")
    String content;

    @Column(name = "tweet_id")
    String tweetId;

    String tweetUrl;

    Instant postedAt;

    Long impressions = 0L;
    Long likes = 0L;
    Long retweets = 0L;
    Long replies = 0L;
    Long quotes = 0L;
    Long bookmarks = 0L;
    Double engagementRate = 0.0;

    Instant lastMetricsUpdate;

    @ElementCollection
    @CollectionTable(name = "post_matched_keyword", joinColumns = @JoinColumn(name = "post_id"))
    @Column(name = "keyword")
    List<String> matchedKeywords = new ArrayList<>();

    boolean hasKeywordMatch;

    Instant createdAt = Instant.now();
}
