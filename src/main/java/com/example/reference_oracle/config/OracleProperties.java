package com.example.reference_oracle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "oracle")
public class OracleProperties {

    /**
     * Senders allowed to relay. Empty means anyone may relay.
     */
    private List<String> relayers = new ArrayList<>();

    private final Storage storage = new Storage();

    public List<String> getRelayers() {
        return relayers;
    }

    public void setRelayers(List<String> relayers) {
        this.relayers = relayers == null ? new ArrayList<>() : relayers;
    }

    public Storage getStorage() {
        return storage;
    }

    public boolean isAllowedRelayer(String sender) {
        return relayers.isEmpty() || (sender != null && relayers.contains(sender));
    }

    public enum StorageType {
        MEMORY,
        FILE
    }

    public static class Storage {

        private StorageType type = StorageType.MEMORY;

        /**
         * State blob location, used with the FILE type.
         */
        private String path = "data/oracle-state.json";

        public StorageType getType() {
            return type;
        }

        public void setType(StorageType type) {
            this.type = type;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }
}
