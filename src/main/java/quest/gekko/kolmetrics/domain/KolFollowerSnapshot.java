package quest.gekko.kolmetrics.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/** Append-only. {@code followersChange} is fixed at insert time. */
@Entity
@Immutable
@Table(name = "kol_follower_snapshot", indexes = @Index(columnList = "kol_id, captured_at"))
@Getter @Setter
public class KolFollowerSnapshot {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "kol_id", nullable = false, updatable = false)
    Kol kol;

    @Column(updatable = false) Long followersCount;
    @Column(updatable = false) Long followingCount;
    @Column(updatable = false) Long followersChange;

    @Column(name = "captured_at", nullable = false, updatable = false)
    Instant capturedAt;
}
