package com.example.reference_oracle.store;

import java.util.Optional;

/**
 * Handle to the single persisted state blob. Implementations replace the whole
 * blob on save; there are no partial writes.
 */
public interface StateStorage {

    /**
     * Returns the last saved blob, or empty if nothing was ever saved.
     */
    Optional<byte[]> load();

    void save(byte[] blob);
}
