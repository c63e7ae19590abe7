package com.example.reference_oracle.store;

import java.util.Optional;

public class InMemoryStateStorage implements StateStorage {

    private volatile byte[] blob;

    @Override
    public Optional<byte[]> load() {
        byte[] current = blob;
        return current == null ? Optional.empty() : Optional.of(current.clone());
    }

    @Override
    public void save(byte[] blob) {
        this.blob = blob.clone();
    }
}
