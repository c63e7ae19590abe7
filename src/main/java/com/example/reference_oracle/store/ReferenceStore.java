package com.example.reference_oracle.store;

import com.example.reference_oracle.error.OracleException;
import com.example.reference_oracle.error.StateStorageException;
import com.example.reference_oracle.model.RateRecord;
import com.example.reference_oracle.model.ReferenceState;
import com.example.reference_oracle.model.RelayBatch;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Symbol to {@link RateRecord} mapping backed by a {@link StateStorage} handle.
 * <p>
 * Every call loads the whole state blob and every successful batch saves the whole
 * state back. Nothing here locks; callers serialize writes.
 */
public class ReferenceStore {

    private final StateStorage storage;
    private final ObjectMapper mapper;

    public ReferenceStore(StateStorage storage) {
        this(storage, new ObjectMapper());
    }

    public ReferenceStore(StateStorage storage, ObjectMapper mapper) {
        this.storage = storage;
        this.mapper = mapper;
    }

    /**
     * Writes an empty state, replacing anything already stored.
     */
    public void initialize() {
        save(ReferenceState.empty());
    }

    public boolean isInitialized() {
        return storage.load().isPresent();
    }

    public void applyBatch(RelayBatch batch) {
        applyBatch(batch.symbols(), batch.rates(), batch.resolveTimes(), batch.requestIds());
    }

    /**
     * Inserts or overwrites one record per index. Duplicate symbols resolve to the
     * last occurrence. The batch is fully validated before the state is touched.
     *
     * @throws OracleException with MISMATCHED_BATCH_LENGTH if the sequences differ in length
     * @throws IllegalArgumentException if a symbol is null or a value is outside the u64 range
     */
    public void applyBatch(List<String> symbols, List<BigInteger> rates,
                           List<BigInteger> resolveTimes, List<BigInteger> requestIds) {
        int len = symbols.size();
        if (rates.size() != len || resolveTimes.size() != len || requestIds.size() != len) {
            throw OracleException.mismatchedBatchLength(len, rates.size(), resolveTimes.size(), requestIds.size());
        }

        List<RateRecord> records = new ArrayList<>(len);
        for (int i = 0; i < len; i++) {
            if (symbols.get(i) == null) {
                throw new IllegalArgumentException("symbol at index " + i + " must not be null");
            }
            records.add(new RateRecord(rates.get(i), resolveTimes.get(i), requestIds.get(i)));
        }

        Map<String, RateRecord> refs = new HashMap<>(snapshot().refs());
        for (int i = 0; i < len; i++) {
            refs.put(symbols.get(i), records.get(i));
        }
        save(new ReferenceState(refs));
    }

    public Optional<RateRecord> get(String symbol) {
        return snapshot().get(symbol);
    }

    /**
     * Loads the current state.
     *
     * @throws StateStorageException if the store was never initialized or the blob cannot be decoded
     */
    public ReferenceState snapshot() {
        byte[] blob = storage.load()
                .orElseThrow(() -> new StateStorageException("Reference state has not been initialized"));
        try {
            return mapper.readValue(blob, ReferenceState.class);
        } catch (IOException e) {
            throw new StateStorageException("Failed to decode reference state", e);
        }
    }

    private void save(ReferenceState state) {
        try {
            storage.save(mapper.writeValueAsBytes(state));
        } catch (IOException e) {
            throw new StateStorageException("Failed to encode reference state", e);
        }
    }
}
