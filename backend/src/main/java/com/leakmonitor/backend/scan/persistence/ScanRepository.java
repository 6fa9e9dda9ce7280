package com.leakmonitor.backend.scan.persistence;

import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.domain.ScanStatus;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ScanRepository extends JpaRepository<Scan, Long> {

  List<Scan> findByStatus(ScanStatus status);

  Optional<Scan> findFirstByOrderByStartedAtDesc();
}
