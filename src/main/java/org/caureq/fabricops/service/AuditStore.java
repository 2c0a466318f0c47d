package org.caureq.fabricops.service;

import lombok.extern.slf4j.Slf4j;
import org.caureq.fabricops.config.FabricProps;
import org.caureq.fabricops.domain.AuditCommit;
import org.caureq.fabricops.domain.AuditRecord;
import org.caureq.fabricops.domain.CommitKind;
import org.caureq.fabricops.domain.ConfigurationArtifact;
import org.caureq.fabricops.repo.AuditCommitRepo;
import org.caureq.fabricops.service.error.CommitNotFoundException;
import org.caureq.fabricops.service.error.ConfigValidationException;
import org.caureq.fabricops.service.error.Stage;
import org.caureq.fabricops.service.error.StoreCorruptionException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Append-only configuration history, one chain per (device, interface).
 * <p>
 * Writers of the same pair are serialized by a per-key lock, so the parent of a commit is always
 * the previous head and sequence numbers follow arrival order. Readers never take the lock:
 * rows are inserted whole and never updated. Commit ids are the first 7+ hex chars of a SHA-256
 * over the record including its sequence number, so identical content still gets distinct ids.
 * <p>
 * Once a record fails its digest check or the database cannot be read, this instance refuses
 * every further operation.
 */
@Service
@Slf4j
public class AuditStore {
    static final int SHORT_ID = 7;
    static final int MAX_CONFIG_CHARS = 32_000;

    private final AuditCommitRepo repo;
    private final Clock clock;
    private final int pageSize;
    private final Map<String, ReentrantLock> keyLocks = new ConcurrentHashMap<>();
    private final AtomicLong sequence;
    private volatile String corruption;

    public AuditStore(AuditCommitRepo repo, Clock clock, FabricProps props) {
        this.repo = repo;
        this.clock = clock;
        this.pageSize = props.pageSize();
        this.sequence = new AtomicLong(read(Stage.COMMIT, repo::maxSeq));
        log.info("[Audit] store ready, last sequence={}", sequence.get());
    }

    /* --------------------- writes --------------------- */

    public AuditRecord commit(String device, String iface, ConfigurationArtifact artifact, String author) {
        return append(Stage.COMMIT, device, iface, artifact, author, CommitKind.CHANGE, null);
    }

    /**
     * Re-commits the content of {@code commitId} as the new head of its (device, interface).
     * Earlier records are left untouched.
     */
    public AuditRecord rollback(String commitId, String author) {
        var target = find(commitId).orElseThrow(() -> new CommitNotFoundException(Stage.ROLLBACK, commitId));
        return append(Stage.ROLLBACK, target.device(), target.iface(), target.artifact(), author,
                CommitKind.ROLLBACK, target.commitId());
    }

    private AuditRecord append(Stage stage, String device, String iface, ConfigurationArtifact artifact,
                               String author, CommitKind kind, String source) {
        ensureUsable(stage);
        var text = artifact.text();
        if (text.length() > MAX_CONFIG_CHARS) {
            throw new ConfigValidationException(stage, device, "rendered configuration exceeds " + MAX_CONFIG_CHARS + " characters");
        }
        var lock = keyLocks.computeIfAbsent(key(device, iface), k -> new ReentrantLock());
        lock.lock();
        try {
            var parent = read(stage, () -> repo.findTopByDeviceAndIfaceOrderBySeqDesc(device, iface))
                    .map(AuditCommit::getCommitId).orElse(null);
            long seq = sequence.incrementAndGet();
            Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
            Instant synthesizedAt = artifact.synthesizedAt().truncatedTo(ChronoUnit.MICROS);
            var digest = digest(seq, device, iface, author, now, parent, kind, source, synthesizedAt, text);

            for (int len = SHORT_ID; len <= digest.length(); len++) {
                var id = digest.substring(0, len);
                if (read(stage, () -> repo.existsByCommitId(id))) continue;
                var row = AuditCommit.builder()
                        .commitId(id).seq(seq)
                        .device(device).iface(iface).author(author)
                        .committedAt(now).parentCommitId(parent)
                        .kind(kind).sourceCommitId(source)
                        .synthesizedAt(synthesizedAt).configText(text)
                        .digest(digest)
                        .build();
                try {
                    repo.saveAndFlush(row);
                } catch (DataIntegrityViolationException e) {
                    // même id court pris entre-temps par un autre couple device/interface
                    log.debug("[Audit] id {} taken concurrently, lengthening", id);
                    continue;
                } catch (DataAccessException e) {
                    throw poison(stage, "audit store write failed: " + e.getMessage(), e);
                }
                log.info("[Audit] {} {} {} commit={} parent={} author={}", kind, device, iface, id, parent, author);
                return toRecord(row);
            }
            throw poison(stage, "could not issue a unique commit id for sequence " + seq, null);
        } finally {
            lock.unlock();
        }
    }

    /* --------------------- reads --------------------- */

    public Optional<AuditRecord> find(String commitId) {
        ensureUsable(Stage.HISTORY);
        if (commitId == null || commitId.isBlank()) return Optional.empty();
        return read(Stage.HISTORY, () -> repo.findByCommitId(commitId.trim())).map(this::verified);
    }

    /** Head of the chain, i.e. the configuration the pair should be running. */
    public Optional<AuditRecord> current(String device, String iface) {
        ensureUsable(Stage.HISTORY);
        return read(Stage.HISTORY, () -> repo.findTopByDeviceAndIfaceOrderBySeqDesc(device, iface)).map(this::verified);
    }

    /** Most recent first, at most {@code limit} records. */
    public List<AuditRecord> history(String device, String iface, int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be positive: " + limit);
        try (var s = stream(device, iface)) {
            return s.limit(limit).toList();
        }
    }

    /**
     * Lazily pages through history, most recent first. Keyset pagination on the sequence number,
     * so commits made while iterating never shift or duplicate entries.
     *
     * @param device optional filter
     * @param iface optional filter, only used together with {@code device}
     */
    public Stream<AuditRecord> stream(String device, String iface) {
        ensureUsable(Stage.HISTORY);
        var it = new Iterator<AuditRecord>() {
            long cursor = Long.MAX_VALUE;
            boolean exhausted;
            final Deque<AuditCommit> buffer = new ArrayDeque<>();

            @Override
            public boolean hasNext() {
                if (buffer.isEmpty() && !exhausted) fetch();
                return !buffer.isEmpty();
            }

            @Override
            public AuditRecord next() {
                if (!hasNext()) throw new NoSuchElementException();
                return verified(buffer.poll());
            }

            private void fetch() {
                var rows = read(Stage.HISTORY, () -> page(device, iface, cursor));
                if (rows.size() < pageSize) exhausted = true;
                if (!rows.isEmpty()) cursor = rows.get(rows.size() - 1).getSeq();
                buffer.addAll(rows);
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private List<AuditCommit> page(String device, String iface, long before) {
        var p = PageRequest.of(0, pageSize);
        if (device == null || device.isBlank()) return repo.findBySeqLessThanOrderBySeqDesc(before, p);
        if (iface == null || iface.isBlank()) return repo.findByDeviceAndSeqLessThanOrderBySeqDesc(device, before, p);
        return repo.findByDeviceAndIfaceAndSeqLessThanOrderBySeqDesc(device, iface, before, p);
    }

    /* --------------------- integrity --------------------- */

    public boolean healthy() { return corruption == null; }

    private AuditRecord verified(AuditCommit row) {
        var expected = digest(row.getSeq(), row.getDevice(), row.getIface(), row.getAuthor(), row.getCommittedAt(),
                row.getParentCommitId(), row.getKind(), row.getSourceCommitId(), row.getSynthesizedAt(), row.getConfigText());
        if (!expected.equals(row.getDigest()) || !expected.startsWith(row.getCommitId())) {
            throw poison(Stage.HISTORY, "commit " + row.getCommitId() + " failed its integrity check", null);
        }
        return toRecord(row);
    }

    private AuditRecord toRecord(AuditCommit row) {
        var artifact = ConfigurationArtifact.fromText(row.getDevice(), row.getIface(), row.getConfigText(), row.getSynthesizedAt());
        return new AuditRecord(row.getCommitId(), row.getSeq(), row.getDevice(), row.getIface(), artifact,
                row.getAuthor(), row.getCommittedAt(), row.getParentCommitId(), row.getKind(), row.getSourceCommitId());
    }

    private void ensureUsable(Stage stage) {
        var c = corruption;
        if (c != null) throw new StoreCorruptionException(stage, "audit store disabled: " + c, null);
    }

    private StoreCorruptionException poison(Stage stage, String reason, Throwable cause) {
        if (corruption == null) corruption = reason;
        log.error("[Audit] store corrupted: {}", reason, cause);
        return new StoreCorruptionException(stage, reason, cause);
    }

    private <T> T read(Stage stage, Supplier<T> op) {
        try {
            return op.get();
        } catch (DataAccessException e) {
            throw poison(stage, "audit store unreadable: " + e.getMessage(), e);
        }
    }

    private static String key(String device, String iface) {
        return device + "|" + iface;
    }

    static String digest(long seq, String device, String iface, String author, Instant committedAt, String parent,
                         CommitKind kind, String source, Instant synthesizedAt, String text) {
        var payload = String.join("\n",
                Long.toString(seq), device, iface, author, committedAt.toString(),
                Objects.toString(parent, ""), kind.name(), Objects.toString(source, ""),
                synthesizedAt.toString(), text);
        try {
            var md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
