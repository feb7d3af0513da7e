package io.mockdispatch.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * The test half of a {@link ConditionalResponseRule}.
 *
 * @param type             where the tested value comes from
 * @param key              header name, query key or body dot-path; null for dependent APIs
 * @param operator         comparison to apply
 * @param value            comparison operand; ignored by {@link ConditionOperator#EXISTS}
 * @param dependentApiId   custom API to invoke for {@link ConditionType#DEPENDENT_API}
 * @param dependentApiPath dot-path into the dependent API's response body
 */
public record Condition(
        ConditionType type,
        String key,
        ConditionOperator operator,
        JsonNode value,
        String dependentApiId,
        String dependentApiPath) {

    public Condition {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
    }

    public static Condition header(String name, ConditionOperator operator, JsonNode value) {
        return new Condition(ConditionType.HEADER, name, operator, value, null, null);
    }

    public static Condition query(String key, ConditionOperator operator, JsonNode value) {
        return new Condition(ConditionType.QUERY, key, operator, value, null, null);
    }

    public static Condition body(String path, ConditionOperator operator, JsonNode value) {
        return new Condition(ConditionType.BODY, path, operator, value, null, null);
    }

    public static Condition dependentApi(String apiId, String path, ConditionOperator operator, JsonNode value) {
        return new Condition(ConditionType.DEPENDENT_API, null, operator, value, apiId, path);
    }
}
