package quest.gekko.kolmetrics.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.kolmetrics.domain.Organization;

import java.util.List;

public interface OrganizationRepository extends JpaRepository<Organization, Long> {
    List<Organization> findAllByOrderByIdAsc();
}
