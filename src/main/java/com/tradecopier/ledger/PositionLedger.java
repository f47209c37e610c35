package com.tradecopier.ledger;

import com.tradecopier.domain.model.Position;
import com.tradecopier.exception.DuplicatePositionException;
import com.tradecopier.exception.PositionNotFoundException;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authoritative in-memory table of open master/slave position pairs, keyed by master position id.
 *
 * <p>Locking has two levels:
 * <ul>
 *   <li>a fixed stripe of {@link ReentrantLock}s, one picked per master position id, serializes
 *       operations on one master position, and {@link #withPositionLock(long, Supplier)} lets
 *       callers hold it across a check-then-act sequence;</li>
 *   <li>a ledger-wide {@link ReentrantReadWriteLock}: every per-key operation holds the read side,
 *       the rebuilds take the write side so a rebuild never interleaves with a half-applied
 *       update.</li>
 * </ul>
 *
 * <p>Rows are stored as private copies and only copies leave the ledger, so callers can never
 * mutate ledger state without going through it. Nothing is persisted: the table is rebuilt from
 * live positions at every session start.
 */
@Component
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    /** Number of key locks. Two positions may share one; actions must not lock another position. */
    public static final int LOCK_STRIPES = 64;

    private final Map<Long, Position> positions = new ConcurrentHashMap<>();
    private final ReentrantLock[] keyLocks = new ReentrantLock[LOCK_STRIPES];
    private final ReentrantReadWriteLock ledgerLock = new ReentrantReadWriteLock();

    public PositionLedger() {
        for (int i = 0; i < LOCK_STRIPES; i++) {
            keyLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Records a newly copied position.
     *
     * @throws DuplicatePositionException if the master position is already paired
     */
    public void upsertOpen(Position position) {
        long masterPositionId = position.getMasterPositionId();
        withPositionLock(masterPositionId, () -> {
            if (positions.containsKey(masterPositionId)) {
                throw new DuplicatePositionException(masterPositionId);
            }
            requireNonNegative(position.getMasterVolume(), "masterVolume");
            requireNonNegative(position.getSlaveVolume(), "slaveVolume");
            positions.put(masterPositionId, position.copy());
            log.debug("Ledger open: masterPositionId={}, slavePositionId={}", masterPositionId, position.getSlavePositionId());
            return null;
        });
    }

    /**
     * Reduces the volumes of a paired position after a confirmed partial close. Both volumes
     * must stay positive; a position reaching zero is removed instead.
     *
     * @return the updated position
     * @throws PositionNotFoundException if the master position is not in the ledger
     */
    public Position adjust(long masterPositionId, BigDecimal newMasterVolume, BigDecimal newSlaveVolume) {
        requirePositive(newMasterVolume, "newMasterVolume");
        requirePositive(newSlaveVolume, "newSlaveVolume");
        return withPositionLock(masterPositionId, () -> {
            Position position = positions.get(masterPositionId);
            if (position == null) {
                throw new PositionNotFoundException(masterPositionId);
            }
            position.setMasterVolume(newMasterVolume);
            position.setSlaveVolume(newSlaveVolume);
            return position.copy();
        });
    }

    /**
     * Drops a position after a confirmed full close.
     *
     * @return the removed position
     * @throws PositionNotFoundException if the master position is not in the ledger
     */
    public Position remove(long masterPositionId) {
        return withPositionLock(masterPositionId, () -> {
            Position removed = positions.remove(masterPositionId);
            if (removed == null) {
                throw new PositionNotFoundException(masterPositionId);
            }
            return removed;
        });
    }

    public Optional<Position> find(long masterPositionId) {
        return Optional.ofNullable(positions.get(masterPositionId)).map(Position::copy);
    }

    public boolean contains(long masterPositionId) {
        return positions.containsKey(masterPositionId);
    }

    /**
     * Runs {@code action} while holding the lock of one master position. Ledger operations on the
     * same key from inside the action are allowed (the lock is reentrant).
     */
    public <T> T withPositionLock(long masterPositionId, Supplier<T> action) {
        ledgerLock.readLock().lock();
        try {
            ReentrantLock keyLock = keyLocks[Math.floorMod(Long.hashCode(masterPositionId), LOCK_STRIPES)];
            keyLock.lock();
            try {
                return action.get();
            } finally {
                keyLock.unlock();
            }
        } finally {
            ledgerLock.readLock().unlock();
        }
    }

    /** Immutable copy of every row, ordered by master position id. */
    public List<Position> snapshot() {
        return positions.values().stream()
                .map(Position::copy)
                .sorted(Comparator.comparingLong(Position::getMasterPositionId))
                .toList();
    }

    public int size() {
        return positions.size();
    }

    /**
     * Atomically replaces the whole table. No per-key operation observes a partially rebuilt
     * ledger.
     *
     * @throws DuplicatePositionException if {@code rebuilt} has two rows for one master position;
     *     the ledger is left unchanged
     */
    public void rebuild(Collection<Position> rebuilt) {
        Map<Long, Position> replacement = index(rebuilt);

        ledgerLock.writeLock().lock();
        try {
            replaceAll(replacement);
        } finally {
            ledgerLock.writeLock().unlock();
        }
    }

    /**
     * Replaces the table with {@code rebuilt}, except for master positions whose live row no longer
     * matches {@code baseline}, the snapshot the rebuild was computed from. Those moved on confirmed
     * outcomes while the rebuild was being computed, and the live state wins:
     * <ul>
     *   <li>a row in the baseline but gone from the ledger was closed and stays closed;</li>
     *   <li>a row that differs from its baseline copy was adjusted and keeps its live volumes;</li>
     *   <li>a row missing from the baseline was opened and is kept.</li>
     * </ul>
     *
     * @return ids of the master positions whose live state was kept, ascending
     * @throws DuplicatePositionException if {@code rebuilt} has two rows for one master position;
     *     the ledger is left unchanged
     */
    public Set<Long> rebuild(Collection<Position> rebuilt, Collection<Position> baseline) {
        Map<Long, Position> replacement = index(rebuilt);
        Map<Long, Position> before = new HashMap<>();
        baseline.forEach(position -> before.put(position.getMasterPositionId(), position));

        ledgerLock.writeLock().lock();
        try {
            Set<Long> movedSinceBaseline = new TreeSet<>();
            for (Long masterPositionId : before.keySet()) {
                if (!positions.containsKey(masterPositionId)) {
                    replacement.remove(masterPositionId);
                    movedSinceBaseline.add(masterPositionId);
                }
            }
            for (Position live : positions.values()) {
                if (!live.equals(before.get(live.getMasterPositionId()))) {
                    replacement.put(live.getMasterPositionId(), live.copy());
                    movedSinceBaseline.add(live.getMasterPositionId());
                }
            }
            if (!movedSinceBaseline.isEmpty()) {
                log.info("Ledger rows changed during rebuild, live state kept: {}", movedSinceBaseline);
            }
            replaceAll(replacement);
            return movedSinceBaseline;
        } finally {
            ledgerLock.writeLock().unlock();
        }
    }

    private static Map<Long, Position> index(Collection<Position> rebuilt) {
        Map<Long, Position> replacement = new HashMap<>();
        for (Position position : rebuilt) {
            if (replacement.putIfAbsent(position.getMasterPositionId(), position.copy()) != null) {
                throw new DuplicatePositionException(position.getMasterPositionId());
            }
        }
        return replacement;
    }

    // Caller holds the write lock.
    private void replaceAll(Map<Long, Position> replacement) {
        int previousSize = positions.size();
        positions.clear();
        positions.putAll(replacement);
        log.info("Ledger rebuilt: {} -> {} positions", previousSize, positions.size());
    }

    private static void requirePositive(BigDecimal volume, String field) {
        if (volume == null || volume.signum() <= 0) {
            throw new IllegalArgumentException(field + " must be positive, got " + volume);
        }
    }

    private static void requireNonNegative(BigDecimal volume, String field) {
        if (volume == null || volume.signum() < 0) {
            throw new IllegalArgumentException(field + " must be non-negative, got " + volume);
        }
    }
}
