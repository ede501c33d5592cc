package quest.gekko.kolmetrics.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/** Append-only. Rows are inserted once per refresh and never updated. */
@Entity
@Immutable
@Table(name = "post_metric_snapshot", indexes = @Index(columnList = "post_id, captured_at"))
@Getter @Setter
public class PostMetricSnapshot {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "post_id", nullable = false, updatable = false)
    Post post;

    @Column(updatable = false) Long impressions;
    @Column(updatable = false) Long likes;
    @Column(updatable = false) Long retweets;
    @Column(updatable = false) Long replies;
    @Column(updatable = false) Long quotes;
    @Column(updatable = false) Long bookmarks;
    @Column(updatable = false) Double engagementRate;

    @Column(name = "captured_at", nullable = false, updatable = false)
    Instant capturedAt;
}
