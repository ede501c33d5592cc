package quest.gekko.kolmetrics.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.kolmetrics.domain.Kol;
import quest.gekko.kolmetrics.domain.KolStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface KolRepository extends JpaRepository<Kol, Long> {
    Optional<Kol> findByIdAndOrganizationId(final Long id, final Long organizationId);

    List<Kol> findByOrganizationIdAndStatusIn(final Long organizationId, final Collection<KolStatus> statuses);

    @Query("""
        select k from Kol k
        where k.status = :status
          and k.twitterHandle is not null
          and trim(k.twitterHandle) <> ''
        order by k.id
        """)
    List<Kol> findWithHandleByStatus(@Param("status") final KolStatus status);
}
