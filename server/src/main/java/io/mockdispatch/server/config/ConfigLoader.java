package io.mockdispatch.server.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code mock-dispatch.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Missing keys keep the defaults of {@link ServerConfig.Builder}. Every key can be overridden
 * by an environment variable, which wins over the YAML value. An env var is "set" if and only
 * if it is defined and its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "mock-dispatch.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, unparseable or holds invalid values
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration, applying overrides from the supplied lookup. A {@code null} result
     * from {@code envLookup} means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, unparseable or holds invalid values
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null) {
            root = MissingNode.getInstance();
        }

        try {
            ServerConfig config = mapToConfig(root, envLookup);
            validate(config);
            return config;
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid numeric value in configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ServerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ServerConfig.Builder builder = ServerConfig.builder();

        // --- YAML mapping ---

        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(intValue(server, "port", "server.port"));
        if (server.has("base-path")) builder.basePath(server.get("base-path").asText());
        if (server.has("max-body-bytes"))
            builder.maxBodyBytes(intValue(server, "max-body-bytes", "server.max-body-bytes"));

        JsonNode definitions = root.path("definitions");
        if (definitions.has("path")) builder.definitionsPath(definitions.get("path").asText());

        JsonNode store = root.path("store");
        if (store.has("type")) builder.storeType(store.get("type").asText());
        if (store.has("path")) builder.storePath(store.get("path").asText());

        JsonNode webhook = root.path("webhook");
        if (webhook.has("timeout-ms")) builder.webhookTimeoutMs(intValue(webhook, "timeout-ms", "webhook.timeout-ms"));
        if (webhook.has("threads")) builder.webhookThreads(intValue(webhook, "threads", "webhook.threads"));
        if (webhook.has("queue-capacity"))
            builder.webhookQueueCapacity(intValue(webhook, "queue-capacity", "webhook.queue-capacity"));

        JsonNode conditional = root.path("conditional");
        if (conditional.has("max-depth"))
            builder.conditionalMaxDepth(intValue(conditional, "max-depth", "conditional.max-depth"));

        JsonNode query = root.path("query");
        if (query.has("default-limit"))
            builder.queryDefaultLimit(intValue(query, "default-limit", "query.default-limit"));

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode admin = root.path("admin");
        if (admin.has("path")) builder.adminPath(admin.get("path").asText());
        if (admin.has("reload-path")) builder.adminReloadPath(admin.get("reload-path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "SERVER_HOST", builder::host);
        envString(envLookup, "SERVER_BASE_PATH", builder::basePath);
        envString(envLookup, "DEFINITIONS_PATH", builder::definitionsPath);
        envString(envLookup, "STORE_TYPE", builder::storeType);
        envString(envLookup, "STORE_PATH", builder::storePath);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "ADMIN_PATH", builder::adminPath);
        envString(envLookup, "ADMIN_RELOAD_PATH", builder::adminReloadPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "SERVER_PORT", builder::port);
        envInt(envLookup, "SERVER_MAX_BODY_BYTES", builder::maxBodyBytes);
        envInt(envLookup, "WEBHOOK_TIMEOUT_MS", builder::webhookTimeoutMs);
        envInt(envLookup, "WEBHOOK_THREADS", builder::webhookThreads);
        envInt(envLookup, "WEBHOOK_QUEUE_CAPACITY", builder::webhookQueueCapacity);
        envInt(envLookup, "CONDITIONAL_MAX_DEPTH", builder::conditionalMaxDepth);
        envInt(envLookup, "QUERY_DEFAULT_LIMIT", builder::queryDefaultLimit);

        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);

        return builder.build();
    }

    /**
     * Rejects values the server cannot start with.
     *
     * @throws ConfigLoadException naming the offending key
     */
    static void validate(ServerConfig config) {
        if (config.port() < 0 || config.port() > 65535) {
            throw new ConfigLoadException("server.port must be between 0 and 65535, got " + config.port());
        }
        requirePath("server.base-path", config.basePath());
        requirePath("health.path", config.healthPath());
        requirePath("admin.path", config.adminPath());
        requirePath("admin.reload-path", config.adminReloadPath());
        if ("/".equals(config.basePath())) {
            throw new ConfigLoadException("server.base-path must not be the root path");
        }
        String storeType = config.storeType().toLowerCase(Locale.ROOT);
        if (!ServerConfig.STORE_MEMORY.equals(storeType) && !ServerConfig.STORE_FILE.equals(storeType)) {
            throw new ConfigLoadException(
                    "store.type must be 'memory' or 'file', got '" + config.storeType() + "'");
        }
        requirePositive("server.max-body-bytes", config.maxBodyBytes());
        requirePositive("webhook.timeout-ms", config.webhookTimeoutMs());
        requirePositive("webhook.threads", config.webhookThreads());
        requirePositive("webhook.queue-capacity", config.webhookQueueCapacity());
        requirePositive("conditional.max-depth", config.conditionalMaxDepth());
        requirePositive("query.default-limit", config.queryDefaultLimit());
        if (!"json".equalsIgnoreCase(config.loggingFormat()) && !"text".equalsIgnoreCase(config.loggingFormat())) {
            throw new ConfigLoadException(
                    "logging.format must be 'json' or 'text', got '" + config.loggingFormat() + "'");
        }
    }

    private static void requirePath(String key, String value) {
        if (value == null || !value.startsWith("/")) {
            throw new ConfigLoadException(key + " must start with '/', got '" + value + "'");
        }
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new ConfigLoadException(key + " must be positive, got " + value);
        }
    }

    // --- Env var helpers ---

    /** {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + raw + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static int intValue(JsonNode section, String field, String key) {
        JsonNode node = section.get(field);
        if (node.canConvertToInt() && node.isNumber()) {
            return node.asInt();
        }
        try {
            return Integer.parseInt(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(key + " must be an integer, got '" + node.asText() + "'", e);
        }
    }
}
