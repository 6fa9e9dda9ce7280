package com.leakmonitor.backend.scan.persistence;

import com.leakmonitor.backend.scan.domain.OsintResult;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OsintResultRepository extends JpaRepository<OsintResult, Long> {

  List<OsintResult> findByScanIdOrderByIdAsc(Long scanId);
}
