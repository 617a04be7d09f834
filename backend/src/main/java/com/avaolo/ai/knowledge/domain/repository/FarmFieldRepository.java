package com.avaolo.ai.knowledge.domain.repository;

import com.avaolo.ai.knowledge.domain.entity.FarmField;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/** Read access to the farmer database. */
@Repository
public interface FarmFieldRepository extends JpaRepository<FarmField, UUID> {

  /** Finds all fields of a farmer, ordered by name. */
  List<FarmField> findByFarmerIdOrderByFieldNameAsc(Long farmerId);

  /** Counts distinct farmers with at least one field. */
  @Query("SELECT COUNT(DISTINCT f.farmerId) FROM FarmField f")
  long countFarmers();
}
