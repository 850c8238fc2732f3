package com.registry.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under the {@code registry} prefix.
 */
@ConfigurationProperties(prefix = "registry")
public class RegistryProperties {

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_JDBC = "jdbc";

    /**
     * Backing store: {@code memory} or {@code jdbc}.
     */
    private String store = STORE_MEMORY;

    private final Pagination pagination = new Pagination();

    private final Security security = new Security();

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public Security getSecurity() {
        return security;
    }

    public static class Pagination {

        private int defaultLimit = 20;

        private int maxLimit = 100;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }

        /**
         * Clamp a requested limit into [1, maxLimit], falling back to the default.
         */
        public int resolveLimit(Integer requested) {
            if (requested == null || requested < 1) {
                return Math.min(defaultLimit, maxLimit);
            }
            return Math.min(requested, maxLimit);
        }

        public int resolvePage(Integer requested) {
            return requested == null || requested < 1 ? 1 : requested;
        }
    }

    public static class Security {

        /**
         * Capability names granted per actor id. {@code *} grants everything.
         */
        private Map<String, List<String>> grants = new LinkedHashMap<>();

        /**
         * Capabilities for actors without an entry in {@link #grants}.
         */
        private List<String> defaultGrants = List.of("*");

        public Map<String, List<String>> getGrants() {
            return grants;
        }

        public void setGrants(Map<String, List<String>> grants) {
            this.grants = grants;
        }

        public List<String> getDefaultGrants() {
            return defaultGrants;
        }

        public void setDefaultGrants(List<String> defaultGrants) {
            this.defaultGrants = defaultGrants;
        }
    }
}
