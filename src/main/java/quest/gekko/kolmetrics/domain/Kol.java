package quest.gekko.kolmetrics.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "kol")
@Getter @Setter
public class Kol {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "organization_id", nullable = false)
    Organization organization;

    @Column(nullable = false)
    String name;

    String twitterHandle;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    KolStatus status = KolStatus.PENDING;

    Long followersCount = 0L;
    Long followingCount = 0L;
    Long avgLikes = 0L;
    Long avgRetweets = 0L;
    Long avgReplies = 0L;
    Double avgEngagementRate = 0.0;

    String avatarUrl;
    String bannerUrl;

    Instant lastMetricsUpdate;
    Instant createdAt = Instant.now();
}
