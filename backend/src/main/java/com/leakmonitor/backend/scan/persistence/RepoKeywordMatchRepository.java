package com.leakmonitor.backend.scan.persistence;

import com.leakmonitor.backend.scan.domain.RepoKeywordMatch;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RepoKeywordMatchRepository extends JpaRepository<RepoKeywordMatch, Long> {

  Optional<RepoKeywordMatch> findByRepoIdAndKeywordAndMatchSource(
      Long repoId, String keyword, String matchSource);

  List<RepoKeywordMatch> findByRepoIdAndActiveTrueOrderByIdAsc(Long repoId);
}
