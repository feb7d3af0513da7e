package io.mockdispatch.core.conditional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.mockdispatch.core.json.JsonNodeUtils;
import io.mockdispatch.core.model.Condition;
import io.mockdispatch.core.model.ConditionalResponseRule;
import io.mockdispatch.core.model.CustomApiDefinition;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses between the two branches of a {@link ConditionalResponseRule}.
 *
 * <p>
 * Conditions read a header, a query parameter, a value in the JSON body, or a value in the
 * response of another custom API (a dependent API). Dependent APIs are computed with the same
 * request, including their own conditional rule but without firing their webhook. A dependent
 * chain that revisits an API or nests deeper than {@code maxDepth} evaluates to {@code false}.
 *
 * <p>
 * Never throws for request-derived input: anything that cannot be resolved makes the condition
 * false. Thread-safe.
 */
public final class ConditionalEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionalEvaluator.class);

    public static final int DEFAULT_MAX_DEPTH = 5;

    private final int maxDepth;

    public ConditionalEvaluator() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth maximum number of nested dependent API computations
     */
    public ConditionalEvaluator(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Computes the body and status a custom API emits for the request in {@code context}: its
     * conditional branch when a rule is defined, otherwise its stored body and status.
     */
    public ConditionalOutcome respond(CustomApiDefinition api, EvaluationContext context) {
        ConditionalResponseRule rule = api.conditionalResponse();
        if (rule == null) {
            return new ConditionalOutcome(api.responseBody(), api.statusCode(), false);
        }
        return evaluate(rule, api.statusCode(), context);
    }

    /**
     * Evaluates a rule.
     *
     * @param baseStatusCode status used when the chosen branch has no status override
     */
    public ConditionalOutcome evaluate(ConditionalResponseRule rule, int baseStatusCode, EvaluationContext context) {
        boolean matched = test(rule.condition(), context);
        if (matched) {
            return new ConditionalOutcome(
                    rule.responseIfTrue(), orDefault(rule.statusCodeIfTrue(), baseStatusCode), true);
        }
        return new ConditionalOutcome(
                rule.responseIfFalse(), orDefault(rule.statusCodeIfFalse(), baseStatusCode), false);
    }

    /** Whether a single condition holds for the request. */
    public boolean test(Condition condition, EvaluationContext context) {
        JsonNode actual = locate(condition, context);
        return switch (condition.operator()) {
            case EXISTS -> JsonNodeUtils.isPresent(actual);
            case EQUALS -> JsonNodeUtils.looseEquals(actual, condition.value());
            case NOT_EQUALS -> !JsonNodeUtils.looseEquals(actual, condition.value());
            case CONTAINS -> contains(actual, condition.value());
            case GREATER_THAN -> compareNumbers(actual, condition.value()) > 0;
            case LESS_THAN -> compareNumbers(actual, condition.value()) < 0;
        };
    }

    private JsonNode locate(Condition condition, EvaluationContext context) {
        return switch (condition.type()) {
            case HEADER -> textOrMissing(context.request().header(condition.key()));
            case QUERY -> textOrMissing(context.request().queryParam(condition.key()));
            case BODY -> JsonNodeUtils.atPath(context.body(), condition.key());
            case DEPENDENT_API -> dependentValue(condition, context);
        };
    }

    private JsonNode dependentValue(Condition condition, EvaluationContext context) {
        String apiId = condition.dependentApiId();
        if (context.isComputing(apiId)) {
            LOG.warn("Dependent API cycle detected: {} -> {}, condition is false", context.chain(), apiId);
            return MissingNode.getInstance();
        }
        if (context.depth() >= maxDepth) {
            LOG.warn("Dependent API chain {} exceeds max depth {}, condition is false", context.chain(), maxDepth);
            return MissingNode.getInstance();
        }
        Optional<CustomApiDefinition> dependent = context.registry().findApi(apiId);
        if (dependent.isEmpty()) {
            LOG.debug("Dependent API '{}' not found, condition is false", apiId);
            return MissingNode.getInstance();
        }
        try {
            ConditionalOutcome outcome = respond(dependent.get(), context.enter(apiId));
            return JsonNodeUtils.atPath(outcome.body(), condition.dependentApiPath());
        } catch (RuntimeException e) {
            LOG.warn("Dependent API '{}' evaluation failed, condition is false: {}", apiId, e.getMessage());
            return MissingNode.getInstance();
        }
    }

    private static boolean contains(JsonNode actual, JsonNode expected) {
        if (!JsonNodeUtils.isPresent(actual) || !JsonNodeUtils.isPresent(expected)) {
            return false;
        }
        if (actual.isArray()) {
            for (JsonNode element : actual) {
                if (JsonNodeUtils.looseEquals(element, expected)) {
                    return true;
                }
            }
            return false;
        }
        if (actual.isContainerNode()) {
            return false;
        }
        return JsonNodeUtils.textForm(actual).contains(JsonNodeUtils.textForm(expected));
    }

    /** Numeric comparison; 0 when either side is not numeric, which makes both orderings false. */
    private static int compareNumbers(JsonNode actual, JsonNode expected) {
        Double left = JsonNodeUtils.asNumber(actual);
        Double right = JsonNodeUtils.asNumber(expected);
        if (left == null || right == null) {
            return 0;
        }
        return Double.compare(left, right);
    }

    private static JsonNode textOrMissing(String value) {
        return value == null ? MissingNode.getInstance() : TextNode.valueOf(value);
    }

    private static int orDefault(Integer override, int fallback) {
        return override != null ? override : fallback;
    }
}
