package com.example.reference_oracle.config;

import com.example.reference_oracle.service.RateResolver;
import com.example.reference_oracle.store.FileStateStorage;
import com.example.reference_oracle.store.InMemoryStateStorage;
import com.example.reference_oracle.store.ReferenceStore;
import com.example.reference_oracle.store.StateStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(OracleProperties.class)
public class OracleConfig {

    private static final Logger log = LoggerFactory.getLogger(OracleConfig.class);

    @Bean
    public StateStorage stateStorage(OracleProperties properties) {
        if (properties.getStorage().getType() == OracleProperties.StorageType.FILE) {
            FileStateStorage storage = new FileStateStorage(Path.of(properties.getStorage().getPath()));
            log.info("Using file state storage at {}", storage.getPath());
            return storage;
        }
        log.info("Using in-memory state storage");
        return new InMemoryStateStorage();
    }

    @Bean
    public ReferenceStore referenceStore(StateStorage stateStorage) {
        return new ReferenceStore(stateStorage);
    }

    @Bean
    public RateResolver rateResolver() {
        return new RateResolver();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
