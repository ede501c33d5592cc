package quest.gekko.kolmetrics.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.kolmetrics.domain.KolFollowerSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface KolFollowerSnapshotRepository extends JpaRepository<KolFollowerSnapshot, Long> {
    Optional<KolFollowerSnapshot> findTopByKolIdOrderByCapturedAtDesc(final Long kolId);

    List<KolFollowerSnapshot> findByKolIdAndCapturedAtBetweenOrderByCapturedAtAsc(
            final Long kolId, final Instant from, final Instant to);

    List<KolFollowerSnapshot> findByKolIdAndCapturedAtGreaterThanEqualAndCapturedAtLessThanOrderByCapturedAtAsc(
            final Long kolId, final Instant from, final Instant to);
}
