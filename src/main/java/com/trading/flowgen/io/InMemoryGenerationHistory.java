package com.trading.flowgen.io;

import com.trading.flowgen.api.GenerationHistory;
import com.trading.flowgen.codegen.CodeGenerationRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Process-local generation history.
 * <p>
 * Saving a record with an existing id replaces it, which is how status
 * transitions are persisted. Thread-safe.
 */
public final class InMemoryGenerationHistory implements GenerationHistory {
    private final Map<String, CodeGenerationRecord> byId = new LinkedHashMap<>();
    private final Map<String, List<String>> idsByInstance = new LinkedHashMap<>();

    @Override
    public synchronized Optional<CodeGenerationRecord> findByHash(String instanceId, String codeHash) {
        for (String id : idsByInstance.getOrDefault(instanceId, List.of())) {
            CodeGenerationRecord r = byId.get(id);
            if (r.getCodeHash().equals(codeHash))
                return Optional.of(r);
        }
        return Optional.empty();
    }

    @Override
    public synchronized CodeGenerationRecord save(CodeGenerationRecord record) {
        Objects.requireNonNull(record, "record");
        CodeGenerationRecord stored = record.getId() != null ? record
                : record.toBuilder().id(UUID.randomUUID().toString()).build();
        CodeGenerationRecord previous = byId.put(stored.getId(), stored);
        if (previous == null)
            idsByInstance.computeIfAbsent(stored.getInstanceId(), k -> new ArrayList<>()).add(stored.getId());
        return stored;
    }

    public synchronized Optional<CodeGenerationRecord> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Records of one instance, newest first.
     *
     * @param skip  number of newest records to skip
     * @param limit maximum number of records returned
     */
    public synchronized List<CodeGenerationRecord> history(String instanceId, int skip, int limit) {
        if (skip < 0 || limit < 0)
            throw new IllegalArgumentException("skip and limit must be non-negative");
        List<CodeGenerationRecord> records = new ArrayList<>();
        for (String id : idsByInstance.getOrDefault(instanceId, List.of()))
            records.add(byId.get(id));
        // insertion order breaks createdAt ties
        List<CodeGenerationRecord> newestFirst = new ArrayList<>(records.size());
        for (int i = records.size() - 1; i >= 0; i--)
            newestFirst.add(records.get(i));
        newestFirst.sort(Comparator.comparing(CodeGenerationRecord::getCreatedAt).reversed());
        return newestFirst.stream().skip(skip).limit(limit).toList();
    }

    public synchronized int count(String instanceId) {
        return idsByInstance.getOrDefault(instanceId, List.of()).size();
    }

    public synchronized int size() {
        return byId.size();
    }
}
