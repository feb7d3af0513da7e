package io.mockdispatch.server.config;

/**
 * Root configuration of the mock server.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param host                 bind address
 * @param port                 listen port; 0 picks a free port
 * @param basePath             mount prefix of the dynamic endpoint surface
 * @param maxBodyBytes         largest accepted request body
 * @param definitionsPath      YAML or JSON file with custom API and resource definitions
 * @param storeType            {@code memory} or {@code file}
 * @param storePath            JSON file used when {@code storeType} is {@code file}
 * @param webhookTimeoutMs     connect and request timeout for webhook deliveries
 * @param webhookThreads       webhook delivery threads
 * @param webhookQueueCapacity pending webhook deliveries before new ones are dropped
 * @param conditionalMaxDepth  maximum dependent API nesting
 * @param queryDefaultLimit    page size when {@code _limit} is absent
 * @param healthEnabled        whether the health endpoint is registered
 * @param healthPath           health endpoint path
 * @param adminPath            prefix of the record admin endpoints
 * @param adminReloadPath      definitions reload endpoint path
 * @param loggingFormat        {@code json} or {@code text}
 * @param loggingLevel         root log level
 */
public record ServerConfig(
        String host,
        int port,
        String basePath,
        int maxBodyBytes,
        String definitionsPath,
        String storeType,
        String storePath,
        int webhookTimeoutMs,
        int webhookThreads,
        int webhookQueueCapacity,
        int conditionalMaxDepth,
        int queryDefaultLimit,
        boolean healthEnabled,
        String healthPath,
        String adminPath,
        String adminReloadPath,
        String loggingFormat,
        String loggingLevel) {

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_FILE = "file";

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ServerConfig}. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 3000;
        private String basePath = "/v1";
        private int maxBodyBytes = 1_048_576; // 1 MiB
        private String definitionsPath = "./definitions.yaml";
        private String storeType = STORE_MEMORY;
        private String storePath = "./data/database.json";
        private int webhookTimeoutMs = 5000;
        private int webhookThreads = 2;
        private int webhookQueueCapacity = 256;
        private int conditionalMaxDepth = 5;
        private int queryDefaultLimit = 10;
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String adminPath = "/admin";
        private String adminReloadPath = "/admin/reload";
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder basePath(String basePath) {
            this.basePath = basePath;
            return this;
        }

        public Builder maxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder definitionsPath(String definitionsPath) {
            this.definitionsPath = definitionsPath;
            return this;
        }

        public Builder storeType(String storeType) {
            this.storeType = storeType;
            return this;
        }

        public Builder storePath(String storePath) {
            this.storePath = storePath;
            return this;
        }

        public Builder webhookTimeoutMs(int webhookTimeoutMs) {
            this.webhookTimeoutMs = webhookTimeoutMs;
            return this;
        }

        public Builder webhookThreads(int webhookThreads) {
            this.webhookThreads = webhookThreads;
            return this;
        }

        public Builder webhookQueueCapacity(int webhookQueueCapacity) {
            this.webhookQueueCapacity = webhookQueueCapacity;
            return this;
        }

        public Builder conditionalMaxDepth(int conditionalMaxDepth) {
            this.conditionalMaxDepth = conditionalMaxDepth;
            return this;
        }

        public Builder queryDefaultLimit(int queryDefaultLimit) {
            this.queryDefaultLimit = queryDefaultLimit;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder adminPath(String adminPath) {
            this.adminPath = adminPath;
            return this;
        }

        public Builder adminReloadPath(String adminReloadPath) {
            this.adminReloadPath = adminReloadPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(
                    host,
                    port,
                    basePath,
                    maxBodyBytes,
                    definitionsPath,
                    storeType,
                    storePath,
                    webhookTimeoutMs,
                    webhookThreads,
                    webhookQueueCapacity,
                    conditionalMaxDepth,
                    queryDefaultLimit,
                    healthEnabled,
                    healthPath,
                    adminPath,
                    adminReloadPath,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
