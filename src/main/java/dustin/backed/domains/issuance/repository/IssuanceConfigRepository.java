package dustin.backed.domains.issuance.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.backed.domains.issuance.model.entity.IssuanceConfig;

/**
 * 발행 설정 Repository
 * Issuance Config Repository
 */
@Repository
public interface IssuanceConfigRepository extends JpaRepository<IssuanceConfig, Long> {
}
