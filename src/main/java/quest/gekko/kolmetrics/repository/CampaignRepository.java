package quest.gekko.kolmetrics.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.kolmetrics.domain.Campaign;

import java.util.List;
import java.util.Optional;

public interface CampaignRepository extends JpaRepository<Campaign, Long> {
    Optional<Campaign> findByIdAndAgencyId(final Long id, final Long agencyId);

    List<Campaign> findByAgencyIdAndProjectTwitterHandleIsNotNull(final Long agencyId);

    @Query("select c from Campaign c left join fetch c.kols where c.id = :id and c.agency.id = :agencyId")
    Optional<Campaign> findWithKolsByIdAndAgencyId(@Param("id") final Long id, @Param("agencyId") final Long agencyId);

    // clients may read the campaigns they are attached to
    @Query("""
        select c from Campaign c
        left join fetch c.kols
        left join c.client cl
        where c.id = :id and (c.agency.id = :orgId or cl.id = :orgId)
        """)
    Optional<Campaign> findWithKolsVisibleTo(@Param("id") final Long id, @Param("orgId") final Long orgId);
}
