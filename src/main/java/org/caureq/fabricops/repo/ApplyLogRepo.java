package org.caureq.fabricops.repo;

import org.caureq.fabricops.domain.ApplyLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface ApplyLogRepo extends JpaRepository<ApplyLog, Long> {
    List<ApplyLog> findByCommitIdOrderByTsDesc(String commitId);
    List<ApplyLog> findByCommitIdIn(Collection<String> commitIds);
}
