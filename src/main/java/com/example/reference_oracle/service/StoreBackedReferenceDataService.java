package com.example.reference_oracle.service;

import com.example.reference_oracle.config.OracleProperties;
import com.example.reference_oracle.error.OracleException;
import com.example.reference_oracle.model.ExecutionContext;
import com.example.reference_oracle.model.RateRecord;
import com.example.reference_oracle.model.ReferenceData;
import com.example.reference_oracle.model.RelayBatch;
import com.example.reference_oracle.store.ReferenceStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Service
public class StoreBackedReferenceDataService implements ReferenceDataService {

    private static final Logger log = LoggerFactory.getLogger(StoreBackedReferenceDataService.class);

    private final ReferenceStore store;
    private final RateResolver resolver;
    private final OracleProperties properties;

    // The store itself does no locking; one relay at a time, queries run alongside each other.
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public StoreBackedReferenceDataService(ReferenceStore store, RateResolver resolver, OracleProperties properties) {
        this.store = store;
        this.resolver = resolver;
        this.properties = properties;
    }

    @PostConstruct
    public void initIfAbsent() {
        if (store.isInitialized()) {
            log.info("Reference state found, keeping {} stored symbols", store.snapshot().refs().size());
            return;
        }
        initialize();
    }

    @Override
    public void initialize() {
        lock.writeLock().lock();
        try {
            store.initialize();
            log.info("Initialized empty reference store");
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void relay(RelayBatch batch, ExecutionContext context) {
        if (!properties.isAllowedRelayer(context.sender())) {
            log.warn("Rejected relay of {} symbols from {}", batch.size(), context.sender());
            throw OracleException.unauthorizedRelayer(context.sender());
        }

        lock.writeLock().lock();
        try {
            store.applyBatch(batch);
        } catch (OracleException e) {
            log.warn("Rejected relay from {}: {}", context.sender(), e.getMessage());
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Applied relay batch of {} symbols from {}", batch.size(), context.sender());
    }

    @Override
    public Map<String, RateRecord> getAllRefs() {
        lock.readLock().lock();
        try {
            return store.snapshot().refs();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<RateRecord> getRef(String symbol) {
        lock.readLock().lock();
        try {
            return store.get(symbol);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ReferenceData getReferenceData(String base, String quote, ExecutionContext context) {
        lock.readLock().lock();
        try {
            return resolver.crossRate(store.snapshot(), base, quote, context.blockTime());
        } finally {
            lock.readLock().unlock();
        }
    }
}
