package com.purchasingpower.policyflow.persistence;

import com.google.common.base.Preconditions;
import com.purchasingpower.policyflow.configuration.AppProperties;
import com.purchasingpower.policyflow.model.SequenceCounter;
import com.purchasingpower.policyflow.repository.SequenceCounterRepository;
import com.purchasingpower.policyflow.util.SequenceNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes the next identifier number for a (collection, field) pair.
 *
 * <p>The next value is {@code max(highest numeric field value in the collection,
 * last value handed out) + increment}, or {@code defaultStart} when neither exists.
 * Prefixed values such as {@code MV100010} compare by their numeric part.
 *
 * <p>Allocation is atomic per key: callers in this process serialize on a key lock,
 * and the durable counter row is read under a pessimistic write lock so separate
 * processes sharing the database cannot hand out the same number. If the counter
 * table cannot be used the in-memory counter takes over.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SequenceAllocator {

    private final SequenceCounterRepository counterRepository;
    private final TransactionTemplate transactionTemplate;
    private final AppProperties props;

    private final Map<String, Long> memoryCounters = new ConcurrentHashMap<>();
    private final Map<String, Object> keyLocks = new ConcurrentHashMap<>();

    /**
     * @param store          backend currently serving the collection
     * @param durableCounter whether to record the value in the counter table
     */
    public long allocate(DocumentStore store, boolean durableCounter, String field, String collection,
                         int increment, long defaultStart) {
        Preconditions.checkNotNull(field, "Sequence field cannot be null");
        Preconditions.checkNotNull(collection, "Collection cannot be null");
        String key = collection + ":" + field;
        Object lock = keyLocks.computeIfAbsent(key, k -> new Object());

        synchronized (lock) {
            OptionalLong scanned = store.indexesSequence(field)
                    ? store.maxSequenceValue(collection)
                    : maxNumericValue(store.findAll(collection), field);

            long next = durableCounter
                    ? allocateDurable(key, scanned, increment, defaultStart)
                    : nextValue(scanned, memoryCounters.get(key), increment, defaultStart);

            memoryCounters.merge(key, next, Math::max);
            log.info("🔢 Allocated {} = {} ({} backend)", key, next, durableCounter ? "durable" : store.getName());
            return next;
        }
    }

    private long allocateDurable(String key, OptionalLong scanned, int increment, long defaultStart) {
        try {
            Long allocated = transactionTemplate.execute(status -> {
                SequenceCounter counter = counterRepository.findForUpdate(key)
                        .orElseGet(() -> SequenceCounter.builder().sequenceKey(key).build());

                Long lastIssued = maxOf(counter.getLastValue(), memoryCounters.get(key));
                long next = nextValue(scanned, lastIssued, increment, defaultStart);

                counter.setLastValue(next);
                counterRepository.save(counter);
                return next;
            });
            if (allocated == null) {
                throw new IllegalStateException("Counter transaction returned no value for " + key);
            }
            return allocated;
        } catch (DataAccessException | TransactionException e) {
            log.warn("⚠️ Counter table unavailable for {}, using in-memory counter: {}", key, e.getMessage());
            return nextValue(scanned, memoryCounters.get(key), increment, defaultStart);
        }
    }

    static long nextValue(OptionalLong scanned, Long lastIssued, int increment, long defaultStart) {
        if (scanned.isEmpty() && lastIssued == null) {
            return defaultStart;
        }
        long base = scanned.orElse(Long.MIN_VALUE);
        if (lastIssued != null) {
            base = Math.max(base, lastIssued);
        }
        return base + increment;
    }

    /**
     * Highest numeric value of {@code field} across the documents; values that are not numeric are ignored.
     */
    public OptionalLong maxNumericValue(List<Map<String, Object>> documents, String field) {
        return documents.stream()
                .map(doc -> numericPortionOf(doc.get(field)))
                .filter(OptionalLong::isPresent)
                .mapToLong(OptionalLong::getAsLong)
                .max();
    }

    /**
     * Numeric part of a sequence value after stripping a known prefix: {@code "MV25"} gives 25,
     * {@code 25} gives 25, {@code "N/A"} gives empty.
     */
    public OptionalLong numericPortionOf(Object value) {
        return SequenceNumbers.numericPortionOf(value, props.getIdentifiers().knownPrefixes());
    }

    private static Long maxOf(Long a, Long b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return Math.max(a, b);
    }
}
