package com.leakmonitor.backend.scan.persistence;

import com.leakmonitor.backend.scan.domain.Keyword;
import com.leakmonitor.backend.scan.domain.KeywordCategory;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface KeywordRepository extends JpaRepository<Keyword, Long> {

  List<Keyword> findByActiveTrueOrderByIdAsc();

  List<Keyword> findByActiveTrueAndCategory(KeywordCategory category);

  boolean existsByTermIgnoreCase(String term);
}
