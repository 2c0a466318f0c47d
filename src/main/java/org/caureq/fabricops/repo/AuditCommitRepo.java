package org.caureq.fabricops.repo;

import org.caureq.fabricops.domain.AuditCommit;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface AuditCommitRepo extends JpaRepository<AuditCommit, Long> {
    Optional<AuditCommit> findByCommitId(String commitId);
    boolean existsByCommitId(String commitId);

    Optional<AuditCommit> findTopByDeviceAndIfaceOrderBySeqDesc(String device, String iface);

    /* keyset pages, most recent first */
    List<AuditCommit> findBySeqLessThanOrderBySeqDesc(long seq, Pageable pageable);
    List<AuditCommit> findByDeviceAndSeqLessThanOrderBySeqDesc(String device, long seq, Pageable pageable);
    List<AuditCommit> findByDeviceAndIfaceAndSeqLessThanOrderBySeqDesc(String device, String iface, long seq, Pageable pageable);

    @Query("select coalesce(max(c.seq), 0) from AuditCommit c")
    long maxSeq();
}
