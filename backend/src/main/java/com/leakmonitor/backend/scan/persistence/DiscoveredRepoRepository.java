package com.leakmonitor.backend.scan.persistence;

import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DiscoveredRepoRepository extends JpaRepository<DiscoveredRepo, Long> {

  Optional<DiscoveredRepo> findByFullName(String fullName);

  List<DiscoveredRepo> findAllByOrderByIdAsc();

  List<DiscoveredRepo> findByScanStatusAndDismissedFalseOrderByIdAsc(RepoScanStatus scanStatus);

  List<DiscoveredRepo> findByRepoSizeKbIsNull();

  long countByScanStatus(RepoScanStatus scanStatus);
}
