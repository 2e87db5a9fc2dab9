package com.trading.flowgen.api;

import com.trading.flowgen.codegen.CodeGenerationRecord;

import java.util.Optional;

/**
 * Store of previously generated modules.
 * <p>
 * The pipeline only ever reads by {@code (instanceId, codeHash)} for
 * deduplication and writes the final record.
 */
public interface GenerationHistory {

    /**
     * Finds a record generated for {@code instanceId} whose code hashes to
     * {@code codeHash}. Records of other instances never match.
     */
    Optional<CodeGenerationRecord> findByHash(String instanceId, String codeHash);

    /** Persists the record and returns the stored instance. */
    CodeGenerationRecord save(CodeGenerationRecord record);
}
