package io.mockdispatch.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import io.mockdispatch.core.conditional.ConditionalEvaluator;
import io.mockdispatch.core.definition.FileDefinitionRepository;
import io.mockdispatch.core.dispatch.RequestDispatcher;
import io.mockdispatch.core.generate.RecordGenerator;
import io.mockdispatch.core.store.FileRecordStore;
import io.mockdispatch.core.store.InMemoryRecordStore;
import io.mockdispatch.core.store.RecordStore;
import io.mockdispatch.core.webhook.HttpWebhookNotifier;
import io.mockdispatch.core.webhook.WebhookNotifier;
import io.mockdispatch.server.config.ConfigLoader;
import io.mockdispatch.server.config.ServerConfig;
import io.mockdispatch.server.http.AdminReloadHandler;
import io.mockdispatch.server.http.ClearRecordsHandler;
import io.mockdispatch.server.http.DispatchHandler;
import io.mockdispatch.server.http.GenerateRecordsHandler;
import io.mockdispatch.server.http.HealthHandler;
import io.mockdispatch.server.http.LogbackConfigurator;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the mock server.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Load the definitions file</li>
 * <li>Open the record store and seed resources that declare a seed</li>
 * <li>Start the webhook notifier</li>
 * <li>Start Javalin with health, admin and mock routes</li>
 * </ol>
 *
 * <p>
 * Separate from {@link MockServerMain} so tests can start and stop servers without going
 * through {@code main()}.
 */
public final class MockServerApp {

    private static final Logger LOG = LoggerFactory.getLogger(MockServerApp.class);

    /** Header carrying the per-request correlation id. */
    public static final String REQUEST_ID_HEADER = "x-request-id";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final List<HandlerType> MOCK_METHODS = List.of(
            HandlerType.GET,
            HandlerType.POST,
            HandlerType.PUT,
            HandlerType.DELETE,
            HandlerType.PATCH,
            HandlerType.HEAD,
            HandlerType.OPTIONS);

    private final Javalin app;
    private final ServerConfig config;
    private final FileDefinitionRepository definitions;
    private final RecordStore store;
    private final WebhookNotifier webhooks;

    private MockServerApp(
            Javalin app,
            ServerConfig config,
            FileDefinitionRepository definitions,
            RecordStore store,
            WebhookNotifier webhooks) {
        this.app = app;
        this.config = config;
        this.definitions = definitions;
        this.store = store;
        this.webhooks = webhooks;
    }

    /**
     * Loads configuration from the command line, configures logging and starts the server.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/config.yaml})
     */
    public static MockServerApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ServerConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config);
        LOG.info("Configuration loaded from {}", configPath);
        return start(config);
    }

    /**
     * Starts a server for an already loaded configuration.
     *
     * @throws io.mockdispatch.core.error.MockDispatchException if definitions or the store fail to load
     */
    public static MockServerApp start(ServerConfig config) {
        long startTime = System.nanoTime();

        FileDefinitionRepository definitions = FileDefinitionRepository.load(Path.of(config.definitionsPath()));

        RecordStore store = ServerConfig.STORE_FILE.equals(config.storeType().toLowerCase(Locale.ROOT))
                ? new FileRecordStore(Path.of(config.storePath()))
                : new InMemoryRecordStore();
        RecordGenerator generator = new RecordGenerator();
        int seeded = generator.seed(definitions.current(), store);

        WebhookNotifier webhooks = new HttpWebhookNotifier(
                MAPPER,
                Duration.ofMillis(config.webhookTimeoutMs()),
                config.webhookThreads(),
                config.webhookQueueCapacity());

        RequestDispatcher dispatcher = RequestDispatcher.builder()
                .definitions(definitions)
                .store(store)
                .webhooks(webhooks)
                .evaluator(new ConditionalEvaluator(config.conditionalMaxDepth()))
                .mapper(MAPPER)
                .defaultLimit(config.queryDefaultLimit())
                .build();

        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.http.maxRequestSize = (long) config.maxBodyBytes();
        });

        app.before(ctx -> {
            String requestId = LogbackConfigurator.bindRequestId(ctx.header(REQUEST_ID_HEADER));
            ctx.header(REQUEST_ID_HEADER, requestId);
        });
        app.after(ctx -> LogbackConfigurator.unbindRequestId());

        app.exception(Exception.class, (e, ctx) -> {
            LOG.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500);
            ctx.contentType("application/json");
            ctx.result("{\"error\":\"Internal server error\"}");
        });

        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler(definitions));
        }
        app.post(config.adminReloadPath(), new AdminReloadHandler(definitions));
        app.post(
                config.adminPath() + "/resources/{name}/generate",
                new GenerateRecordsHandler(definitions, store, generator));
        app.delete(config.adminPath() + "/resources/{name}/records", new ClearRecordsHandler(definitions, store));

        String mockRoute = config.basePath() + "/<path>";
        app.before(mockRoute, ctx -> {
            if (!MOCK_METHODS.contains(ctx.method())) {
                ctx.status(405);
                ctx.contentType("application/json");
                ctx.result("{\"error\":\"HTTP method " + ctx.method().name() + " is not supported\"}");
                ctx.skipRemainingHandlers();
            }
        });
        DispatchHandler dispatchHandler = new DispatchHandler(dispatcher, config.basePath(), config.maxBodyBytes());
        for (HandlerType method : MOCK_METHODS) {
            app.addHttpHandler(method, config.basePath(), dispatchHandler);
            app.addHttpHandler(method, mockRoute, dispatchHandler);
        }

        app.start(config.host(), config.port());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "mock-dispatch started: port={}, basePath={}, apis={}, resources={}, seeded={}, store={}, startupMs={}",
                app.port(),
                config.basePath(),
                definitions.current().apis().size(),
                definitions.current().resources().size(),
                seeded,
                config.storeType(),
                elapsedMs);

        return new MockServerApp(app, config, definitions, store, webhooks);
    }

    /** Returns the port the server is listening on. */
    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public ServerConfig config() {
        return config;
    }

    public FileDefinitionRepository definitions() {
        return definitions;
    }

    public RecordStore store() {
        return store;
    }

    /** Stops Javalin and the webhook notifier. */
    public void stop() {
        app.stop();
        webhooks.close();
        LOG.info("mock-dispatch stopped");
    }
}
