package com.leakmonitor.backend.scan.persistence;

import com.leakmonitor.backend.scan.domain.Finding;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FindingRepository extends JpaRepository<Finding, Long> {

  Optional<Finding> findByFindingHash(String findingHash);

  boolean existsByRepoIdAndResolvedFalse(Long repoId);

  long countByResolvedFalse();

  @Query("select f from Finding f join fetch f.repo where f.id = :id")
  Optional<Finding> findWithRepoById(@Param("id") Long id);

  @Query("select f from Finding f join fetch f.repo where f.resolved = false order by f.repo.id, f.id")
  List<Finding> findOpenWithRepo();
}
