package io.mockdispatch.core.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mockdispatch.core.conditional.ConditionalEvaluator;
import io.mockdispatch.core.conditional.ConditionalOutcome;
import io.mockdispatch.core.conditional.EvaluationContext;
import io.mockdispatch.core.definition.DefinitionRegistry;
import io.mockdispatch.core.definition.DefinitionRepository;
import io.mockdispatch.core.error.InvalidRequestBodyException;
import io.mockdispatch.core.error.ItemNotFoundException;
import io.mockdispatch.core.model.CustomApiDefinition;
import io.mockdispatch.core.model.MockRequest;
import io.mockdispatch.core.model.MockResponse;
import io.mockdispatch.core.query.QueryDirectives;
import io.mockdispatch.core.query.QueryEngine;
import io.mockdispatch.core.routing.RouteMatch;
import io.mockdispatch.core.routing.RouteResolver;
import io.mockdispatch.core.store.RecordStore;
import io.mockdispatch.core.webhook.WebhookNotifier;
import io.mockdispatch.core.webhook.WebhookPayload;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves one request on the dynamic endpoint surface.
 *
 * <p>
 * Captures the current {@link DefinitionRegistry}, resolves the route, then answers from a
 * custom API (firing its webhook and applying its conditional rule) or from a resource
 * collection (item CRUD or the query pipeline). Every failure is turned into a response here:
 * callers never see an exception from {@link #dispatch(MockRequest)}.
 *
 * <p>
 * Thread-safe; one instance serves all requests.
 */
public final class RequestDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(RequestDispatcher.class);

    static final String INTERNAL_ERROR = "Internal server error";
    static final String ITEM_NOT_FOUND = "Item not found";
    static final String MULTI_SEGMENT_HINT =
            "For multi-segment paths like \"/devices/chart\", create a Custom API instead of a Resource.";
    static final String EMPTY_HINT = "No resources or custom APIs created yet.";

    private final DefinitionRepository definitions;
    private final RouteResolver resolver = new RouteResolver();
    private final ConditionalEvaluator evaluator;
    private final WebhookNotifier webhooks;
    private final ResourceRequestHandler resources;
    private final ObjectMapper mapper;

    private RequestDispatcher(Builder builder) {
        this.definitions = Objects.requireNonNull(builder.definitions, "definitions must not be null");
        this.webhooks = Objects.requireNonNull(builder.webhooks, "webhooks must not be null");
        RecordStore store = Objects.requireNonNull(builder.store, "store must not be null");
        this.mapper = builder.mapper;
        this.evaluator = builder.evaluator;
        this.resources = new ResourceRequestHandler(
                store, new QueryEngine(store), builder.mapper, builder.clock, builder.idGenerator, builder.defaultLimit);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Computes the response for a request. Never throws.
     */
    public MockResponse dispatch(MockRequest request) {
        MockResponse response;
        String route;
        try {
            DefinitionRegistry registry = definitions.current();
            RouteMatch match = resolver.resolve(request.method(), request.path(), registry);
            if (match instanceof RouteMatch.CustomApiMatch api) {
                route = "api:" + api.api().id();
                response = serveCustomApi(request, api.api(), registry);
            } else if (match instanceof RouteMatch.ResourceMatch resource) {
                route = "resource:" + resource.resource().name();
                response = resources.handle(request, resource)
                        .orElseGet(() -> notFound(request, registry.resourceNames(), registry.apiSignatures()));
            } else {
                RouteMatch.NotFound notFound = (RouteMatch.NotFound) match;
                route = "none";
                response = notFound(request, notFound.availableResources(), notFound.availableApis());
            }
        } catch (InvalidRequestBodyException e) {
            route = "invalid";
            response = MockResponse.error(400, e.getMessage());
        } catch (ItemNotFoundException e) {
            route = "resource:" + e.resourceName();
            response = MockResponse.error(404, ITEM_NOT_FOUND);
        } catch (RuntimeException e) {
            LOG.error("Error handling {} {}", request.method(), request.path(), e);
            route = "error";
            response = MockResponse.error(500, INTERNAL_ERROR);
        }
        LOG.info("{} {} -> {} ({})", request.method(), request.path(), response.statusCode(), route);
        return response;
    }

    private MockResponse serveCustomApi(MockRequest request, CustomApiDefinition api, DefinitionRegistry registry) {
        if (api.hasWebhook()) {
            try {
                webhooks.notify(
                        api.webhookUrl(),
                        new WebhookPayload(
                                request.method(),
                                normalizedPath(request.path()),
                                RequestBodies.parseOrText(mapper, request)));
            } catch (RuntimeException e) {
                LOG.warn("Webhook for custom API '{}' not scheduled: {}", api.id(), e.toString());
            }
        }
        EvaluationContext context =
                EvaluationContext.root(request, RequestBodies.parseOrNull(mapper, request), registry, api.id());
        ConditionalOutcome outcome = evaluator.respond(api, context);
        if (api.conditionalResponse() != null) {
            LOG.debug("Custom API '{}' condition matched={}", api.id(), outcome.matched());
        }
        return MockResponse.json(outcome.statusCode(), outcome.body());
    }

    /** 404 body listing what does exist; empty lists are left out. */
    static MockResponse notFound(MockRequest request, List<String> resourceNames, List<String> apiSignatures) {
        List<String> segments = segments(request.path());
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("error", "Mock API not found for " + request.method() + " /" + String.join("/", segments));
        if (segments.size() > 1) {
            body.put("hint", MULTI_SEGMENT_HINT);
        } else if (!resourceNames.isEmpty()) {
            body.put("hint", "Available resources: " + String.join(", ", resourceNames));
        } else {
            body.put("hint", EMPTY_HINT);
        }
        if (!resourceNames.isEmpty()) {
            ArrayNode names = body.putArray("availableResources");
            resourceNames.forEach(names::add);
        }
        if (!apiSignatures.isEmpty()) {
            ArrayNode apis = body.putArray("availableApis");
            apiSignatures.forEach(apis::add);
        }
        return MockResponse.json(404, body);
    }

    private static String normalizedPath(String path) {
        return "/" + String.join("/", segments(path));
    }

    private static List<String> segments(String path) {
        return Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).toList();
    }

    /** Builder with production defaults for everything except the collaborators. */
    public static final class Builder {

        private DefinitionRepository definitions;
        private RecordStore store;
        private WebhookNotifier webhooks;
        private ConditionalEvaluator evaluator = new ConditionalEvaluator();
        private ObjectMapper mapper = new ObjectMapper();
        private Clock clock = Clock.systemUTC();
        private Supplier<String> idGenerator = ResourceRequestHandler.randomUuids();
        private int defaultLimit = QueryDirectives.DEFAULT_LIMIT;

        private Builder() {}

        public Builder definitions(DefinitionRepository definitions) {
            this.definitions = definitions;
            return this;
        }

        public Builder store(RecordStore store) {
            this.store = store;
            return this;
        }

        public Builder webhooks(WebhookNotifier webhooks) {
            this.webhooks = webhooks;
            return this;
        }

        public Builder evaluator(ConditionalEvaluator evaluator) {
            this.evaluator = Objects.requireNonNull(evaluator);
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper);
            return this;
        }

        /** Clock stamping {@code createdAt} on created records. */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        /** Source of ids for records created by collection POST. */
        public Builder idGenerator(Supplier<String> idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator);
            return this;
        }

        public Builder defaultLimit(int defaultLimit) {
            if (defaultLimit < 1) {
                throw new IllegalArgumentException("defaultLimit must be >= 1, got " + defaultLimit);
            }
            this.defaultLimit = defaultLimit;
            return this;
        }

        public RequestDispatcher build() {
            return new RequestDispatcher(this);
        }
    }
}
