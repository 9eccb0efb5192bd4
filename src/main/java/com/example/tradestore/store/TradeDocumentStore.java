package com.example.tradestore.store;

import com.example.tradestore.config.TradeStoreProperties;
import com.example.tradestore.document.MergeEngine;
import com.example.tradestore.exception.DuplicateTradeIdException;
import com.example.tradestore.exception.TradeNotFoundException;
import com.example.tradestore.exception.TradeValidationException;
import com.example.tradestore.exception.VersionConflictException;
import com.example.tradestore.filter.FilterMatcher;
import com.example.tradestore.filter.JsonValues;
import com.example.tradestore.filter.TradeFilter;
import com.example.tradestore.model.Context;
import com.example.tradestore.model.MutationType;
import com.example.tradestore.model.OperationLogEntry;
import com.example.tradestore.model.TradeRecord;
import com.example.tradestore.model.TradeType;
import com.example.tradestore.model.ValidationResult;
import com.example.tradestore.validation.ContextGuard;
import com.example.tradestore.validation.TradeTypeDetector;
import com.example.tradestore.validation.ValidatorChain;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory trade document store.
 * <p>
 * Records live in insertion order behind a single read/write lock. Every mutation runs its
 * whole check, validate and write sequence under the write lock, so two concurrent saves of the
 * same id can never both succeed. Reads take the read lock and hand out deep copies; stored
 * documents are never aliased outside the store.
 * <p>
 * Mutations require a complete audit context, checked before anything else. A rejected mutation
 * leaves the store untouched. Committed mutations are queued under the write lock and handed to
 * lifecycle listeners after it is released, one dispatching thread at a time, so listeners see
 * them in commit order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeDocumentStore {

    private final ContextGuard contextGuard;
    private final ValidatorChain validatorChain;
    private final MergeEngine mergeEngine;
    private final FilterMatcher filterMatcher;
    private final TradeTypeDetector tradeTypeDetector;
    private final TradeStoreProperties properties;
    private final Clock clock;
    private final List<TradeLifecycleListener> listeners;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, TradeRecord> records = new LinkedHashMap<>();
    private final Deque<OperationLogEntry> operationLog = new ArrayDeque<>();
    private final Map<MutationType, Long> operationCounts = new EnumMap<>(MutationType.class);
    private final Queue<Mutation> pendingEvents = new ConcurrentLinkedQueue<>();
    private final ReentrantLock dispatchLock = new ReentrantLock();

    // ---------------------------------------------------------------- mutations

    /**
     * Creates version 1 of a new trade.
     *
     * @throws DuplicateTradeIdException when {@code id} denotes a live record
     * @throws TradeValidationException  when the document fails validation
     */
    public SaveResult saveNew(Context context, String id, JsonNode document) {
        Context audit = contextGuard.require(context);
        String tradeId = requireId(id);
        ObjectNode data = requireDocument(document).deepCopy();

        Mutation mutation;
        lock.writeLock().lock();
        try {
            if (records.containsKey(tradeId)) {
                log.warn("Rejected save-new: trade {} already exists", tradeId);
                throw new DuplicateTradeIdException(tradeId);
            }
            ValidationResult validation = validate(MutationType.SAVE_NEW, tradeId, data);

            Instant now = clock.instant();
            TradeRecord record = TradeRecord.builder()
                    .id(tradeId)
                    .data(data)
                    .version(1)
                    .createdAt(now)
                    .updatedAt(now)
                    .lastContext(audit)
                    .build();
            mutation = commit(MutationType.SAVE_NEW, record, audit, validation, now);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Created trade {} (type: {}, user: {})", tradeId, mutation.tradeType().code(), audit.user());
        dispatchPending();
        return mutation.result();
    }

    public SaveResult saveFullReplace(Context context, String id, JsonNode document) {
        return saveFullReplace(context, id, document, null);
    }

    /**
     * Replaces the whole document of a live trade. The new document is validated on its own.
     *
     * @param expectedVersion optional; when given it must equal the current version
     */
    public SaveResult saveFullReplace(Context context, String id, JsonNode document, Long expectedVersion) {
        ObjectNode replacement = requireDocument(document);
        return update(MutationType.SAVE_UPDATE, context, id, expectedVersion, existing -> replacement.deepCopy());
    }

    public SaveResult savePartial(Context context, String id, JsonNode patch) {
        return savePartial(context, id, patch, null);
    }

    /**
     * Deep-merges {@code patch} onto a live trade and validates the merged document.
     *
     * @see MergeEngine
     */
    public SaveResult savePartial(Context context, String id, JsonNode patch, Long expectedVersion) {
        if (patch == null || !patch.isObject()) {
            throw new IllegalArgumentException("Patch must be a JSON object");
        }
        return update(MutationType.SAVE_PARTIAL, context, id, expectedVersion,
                existing -> mergeEngine.merge(existing, patch));
    }

    /**
     * Removes a trade. Deleting an unknown id is not an error.
     *
     * @return 1 when a record was removed, 0 otherwise
     */
    public int deleteById(Context context, String id) {
        Context audit = contextGuard.require(context);
        String tradeId = requireId(id);

        boolean removed;
        lock.writeLock().lock();
        try {
            removed = remove(tradeId, audit).isPresent();
        } finally {
            lock.writeLock().unlock();
        }

        if (!removed) {
            log.info("Delete of trade {} affected nothing, no such trade", tradeId);
            return 0;
        }
        log.info("Deleted trade {} (user: {})", tradeId, audit.user());
        dispatchPending();
        return 1;
    }

    /**
     * Removes every listed trade in one atomic step. The context is checked once for the batch;
     * unknown ids are reported, never an error.
     */
    public DeleteResult deleteByGroup(Context context, Collection<String> ids) {
        Context audit = contextGuard.require(context);
        if (ids == null) {
            throw new IllegalArgumentException("Trade ids must not be null");
        }
        LinkedHashSet<String> tradeIds = new LinkedHashSet<>();
        ids.forEach(id -> tradeIds.add(requireId(id)));

        List<String> deleted = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        lock.writeLock().lock();
        try {
            for (String tradeId : tradeIds) {
                if (remove(tradeId, audit).isPresent()) {
                    deleted.add(tradeId);
                } else {
                    missing.add(tradeId);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Group delete removed {} trade(s), {} not found (user: {})", deleted.size(), missing.size(), audit.user());
        dispatchPending();
        return new DeleteResult(deleted.size(), deleted, missing);
    }

    /**
     * Drops every record and the operation log, then logs the purge itself.
     *
     * @return number of trades removed
     */
    public int purge(Context context) {
        Context audit = contextGuard.require(context);

        int removed;
        lock.writeLock().lock();
        try {
            removed = records.size();
            records.clear();
            operationLog.clear();
            Instant now = clock.instant();
            OperationLogEntry entry = appendLog(MutationType.PURGE, null, null, audit, now);
            pendingEvents.add(new Mutation(entry, TradeType.UNKNOWN, null));
        } finally {
            lock.writeLock().unlock();
        }

        log.warn("Purged {} trade(s) from the store (user: {}, intent: {})", removed, audit.user(), audit.intent());
        dispatchPending();
        return removed;
    }

    // ---------------------------------------------------------------- reads

    public Optional<TradeRecord> findById(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(id)).map(TradeRecord::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws TradeNotFoundException when no live record has this id
     */
    public TradeRecord loadById(String id) {
        log.debug("Loading trade {}", id);
        return findById(id).orElseThrow(() -> new TradeNotFoundException(id));
    }

    public LoadResult loadByIds(Collection<String> ids) {
        List<TradeRecord> found = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (String id : new LinkedHashSet<>(ids)) {
                TradeRecord record = records.get(id);
                if (record != null) {
                    found.add(record.copy());
                } else {
                    missing.add(id);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        log.debug("Loaded {} of {} requested trade(s)", found.size(), found.size() + missing.size());
        return new LoadResult(found, missing);
    }

    /**
     * Records matching every predicate of {@code filter}, in insertion order unless the filter
     * names a sort path, then paged.
     */
    public List<TradeRecord> list(TradeFilter filter) {
        lock.readLock().lock();
        try {
            List<TradeRecord> result = pageOf(filter);
            log.debug("List matched {} trade(s) with {} predicate(s)", result.size(), filter.predicates().size());
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * One page of {@link #list} together with the total number of matches, read under a single
     * read lock so the two always agree.
     */
    public TradePage page(TradeFilter filter) {
        lock.readLock().lock();
        try {
            TradePage page = new TradePage(pageOf(filter), matching(filter).count());
            log.debug("Page holds {} of {} matching trade(s)", page.trades().size(), page.totalMatching());
            return page;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of records matching {@code filter}; paging is ignored.
     */
    public long count(TradeFilter filter) {
        lock.readLock().lock();
        try {
            return matching(filter).count();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Successful mutations, oldest first.
     */
    public List<OperationLogEntry> operationLog() {
        lock.readLock().lock();
        try {
            return List.copyOf(operationLog);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<OperationLogEntry> operationLog(String tradeId) {
        return operationLog().stream()
                .filter(entry -> tradeId.equals(entry.tradeId()))
                .collect(Collectors.toList());
    }

    public Map<String, Object> statistics() {
        lock.readLock().lock();
        try {
            Map<String, Object> stats = new HashMap<>();
            stats.put("totalTrades", records.size());

            Map<String, Long> typeCounts = records.values().stream()
                    .collect(Collectors.groupingBy(
                            record -> tradeTypeDetector.detect(record.data()).code(),
                            Collectors.counting()
                    ));
            stats.put("tradeTypeCounts", typeCounts);
            stats.put("operationCounts", new EnumMap<>(operationCounts));
            stats.put("operationLogSize", operationLog.size());

            return stats;
        } finally {
            lock.readLock().unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        lock.writeLock().lock();
        try {
            log.info("Shutting down trade store, releasing {} trade(s)", records.size());
            records.clear();
            operationLog.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------- internals

    private SaveResult update(MutationType operation, Context context, String id, Long expectedVersion,
                              UnaryOperator<ObjectNode> newData) {
        Context audit = contextGuard.require(context);
        String tradeId = requireId(id);

        Mutation mutation;
        lock.writeLock().lock();
        try {
            TradeRecord existing = records.get(tradeId);
            if (existing == null) {
                log.warn("Rejected {}: trade {} not found", operation, tradeId);
                throw new TradeNotFoundException(tradeId);
            }
            if (expectedVersion != null && expectedVersion != existing.version()) {
                log.warn("Rejected {}: trade {} is at version {}, caller expected {}",
                        operation, tradeId, existing.version(), expectedVersion);
                throw new VersionConflictException(tradeId, expectedVersion, existing.version());
            }

            ObjectNode data = newData.apply(existing.data());
            ValidationResult validation = validate(operation, tradeId, data);

            Instant now = clock.instant();
            TradeRecord updated = existing.toBuilder()
                    .data(data)
                    .version(existing.version() + 1)
                    .updatedAt(now)
                    .lastContext(audit)
                    .build();
            mutation = commit(operation, updated, audit, validation, now);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Updated trade {} to version {} via {} (user: {})",
                tradeId, mutation.result().record().version(), operation, audit.user());
        dispatchPending();
        return mutation.result();
    }

    private ValidationResult validate(MutationType operation, String tradeId, ObjectNode data) {
        ValidationResult validation = validatorChain.validate(data);
        if (!validation.success()) {
            log.warn("Rejected {} of trade {}: {}", operation, tradeId, validation.errors());
            throw new TradeValidationException(validation);
        }
        return validation;
    }

    // caller holds the write lock
    private Mutation commit(MutationType operation, TradeRecord record, Context audit,
                            ValidationResult validation, Instant now) {
        if (operation == MutationType.SAVE_NEW) {
            if (records.putIfAbsent(record.id(), record) != null) {
                throw new IllegalStateException("Trade " + record.id() + " appeared while holding the write lock");
            }
        } else {
            records.put(record.id(), record);
        }
        OperationLogEntry entry = appendLog(operation, record.id(), record.version(), audit, now);
        TradeType tradeType = validation.tradeType() != null
                ? validation.tradeType()
                : tradeTypeDetector.detect(record.data());
        Mutation mutation = new Mutation(entry, tradeType, new SaveResult(record.copy(), validation));
        pendingEvents.add(mutation);
        return mutation;
    }

    // caller holds the write lock
    private Optional<Mutation> remove(String tradeId, Context audit) {
        TradeRecord removed = records.remove(tradeId);
        if (removed == null) {
            return Optional.empty();
        }
        OperationLogEntry entry = appendLog(MutationType.DELETE, tradeId, removed.version(), audit, clock.instant());
        Mutation mutation = new Mutation(entry, tradeTypeDetector.detect(removed.data()), null);
        pendingEvents.add(mutation);
        return Optional.of(mutation);
    }

    // caller holds the write lock
    private OperationLogEntry appendLog(MutationType operation, String tradeId, Long version,
                                       Context audit, Instant now) {
        OperationLogEntry entry = OperationLogEntry.builder()
                .timestamp(now)
                .operation(operation)
                .tradeId(tradeId)
                .version(version)
                .context(audit)
                .build();
        operationLog.addLast(entry);
        int maxEntries = Math.max(1, properties.getOperationLog().getMaxEntries());
        while (operationLog.size() > maxEntries) {
            operationLog.removeFirst();
        }
        operationCounts.merge(operation, 1L, Long::sum);
        return entry;
    }

    // caller holds a lock
    private Stream<TradeRecord> matching(TradeFilter filter) {
        if (filter.isEmpty()) {
            return records.values().stream();
        }
        return records.values().stream()
                .filter(record -> filterMatcher.matches(new RecordFieldResolver(record), filter));
    }

    // caller holds a lock
    private List<TradeRecord> pageOf(TradeFilter filter) {
        Stream<TradeRecord> matching = matching(filter);
        if (filter.sortBy() != null && !filter.sortBy().isBlank()) {
            matching = matching.sorted(sortComparator(filter.sortBy(), filter.descending()));
        }
        matching = matching.skip(filter.offset());
        if (filter.limit() != null) {
            matching = matching.limit(filter.limit());
        }
        return matching.map(TradeRecord::copy).collect(Collectors.toList());
    }

    private Comparator<TradeRecord> sortComparator(String sortBy, boolean descending) {
        Comparator<JsonNode> valueOrder = descending ? JsonValues.sortOrder().reversed() : JsonValues.sortOrder();
        return (left, right) -> {
            JsonNode a = new RecordFieldResolver(left).resolve(sortBy);
            JsonNode b = new RecordFieldResolver(right).resolve(sortBy);
            boolean aAbsent = JsonValues.isAbsent(a);
            boolean bAbsent = JsonValues.isAbsent(b);
            // records without the sort field go last in either direction
            if (aAbsent || bAbsent) {
                return Boolean.compare(aAbsent, bAbsent);
            }
            return valueOrder.compare(a, b);
        };
    }

    /**
     * Delivers queued mutations in commit order. A caller that finds another thread dispatching
     * leaves its mutation to that thread; the re-check after unlocking picks up anything queued
     * while the dispatcher was finishing.
     */
    private void dispatchPending() {
        while (!pendingEvents.isEmpty() && dispatchLock.tryLock()) {
            try {
                Mutation mutation;
                while ((mutation = pendingEvents.poll()) != null) {
                    notifyListeners(mutation);
                }
            } finally {
                dispatchLock.unlock();
            }
        }
    }

    private void notifyListeners(Mutation mutation) {
        for (TradeLifecycleListener listener : listeners) {
            try {
                listener.onMutation(mutation.entry(), mutation.tradeType());
            } catch (RuntimeException e) {
                log.error("Lifecycle listener {} failed for {} of trade {}: {}",
                        listener.getClass().getSimpleName(), mutation.entry().operation(),
                        mutation.entry().tradeId(), e.getMessage(), e);
            }
        }
    }

    private static String requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Trade id must not be blank");
        }
        return id;
    }

    private static ObjectNode requireDocument(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new IllegalArgumentException("Trade document must be a JSON object");
        }
        return (ObjectNode) document;
    }

    private record Mutation(OperationLogEntry entry, TradeType tradeType, SaveResult result) {
    }
}
