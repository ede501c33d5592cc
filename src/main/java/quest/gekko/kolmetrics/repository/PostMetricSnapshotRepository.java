package quest.gekko.kolmetrics.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.kolmetrics.domain.PostMetricSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PostMetricSnapshotRepository extends JpaRepository<PostMetricSnapshot, Long> {
    Optional<PostMetricSnapshot> findTopByPostIdOrderByCapturedAtDesc(final Long postId);

    List<PostMetricSnapshot> findByPostIdAndCapturedAtBetweenOrderByCapturedAtAsc(
            final Long postId, final Instant from, final Instant to);

    List<PostMetricSnapshot> findByPostIdAndCapturedAtGreaterThanEqualAndCapturedAtLessThanOrderByCapturedAtAsc(
            final Long postId, final Instant from, final Instant to);
}
