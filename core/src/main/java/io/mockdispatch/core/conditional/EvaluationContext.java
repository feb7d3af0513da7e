package io.mockdispatch.core.conditional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.mockdispatch.core.definition.DefinitionRegistry;
import io.mockdispatch.core.model.MockRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything a condition may look at: the inbound request, its parsed JSON body, the
 * definitions snapshot (for dependent APIs) and the chain of custom API ids currently being
 * computed.
 *
 * <p>
 * Immutable. {@link #enter(String)} returns a child context one level deeper.
 */
public final class EvaluationContext {

    private final MockRequest request;
    private final JsonNode body;
    private final DefinitionRegistry registry;
    private final List<String> chain;

    private EvaluationContext(MockRequest request, JsonNode body, DefinitionRegistry registry, List<String> chain) {
        this.request = request;
        this.body = body;
        this.registry = registry;
        this.chain = chain;
    }

    /**
     * Root context for a request.
     *
     * @param body   the request body parsed as JSON, or null when absent or malformed
     * @param apiId  id of the custom API being served
     */
    public static EvaluationContext root(MockRequest request, JsonNode body, DefinitionRegistry registry, String apiId) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        return new EvaluationContext(
                request, body == null ? MissingNode.getInstance() : body, registry, List.of(apiId));
    }

    /** Child context for computing the dependent API {@code apiId}. */
    EvaluationContext enter(String apiId) {
        List<String> next = new ArrayList<>(chain);
        next.add(apiId);
        return new EvaluationContext(request, body, registry, List.copyOf(next));
    }

    boolean isComputing(String apiId) {
        return chain.contains(apiId);
    }

    /** Number of nested dependent API computations; 0 at the root. */
    int depth() {
        return chain.size() - 1;
    }

    public MockRequest request() {
        return request;
    }

    /** The parsed request body, {@link MissingNode} when there is none. */
    public JsonNode body() {
        return body;
    }

    public DefinitionRegistry registry() {
        return registry;
    }

    /** Custom API ids from the served API down to the one currently computed. */
    public List<String> chain() {
        return chain;
    }
}
