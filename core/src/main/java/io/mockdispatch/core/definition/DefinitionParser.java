package io.mockdispatch.core.definition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.mockdispatch.core.error.DefinitionParseException;
import io.mockdispatch.core.model.Condition;
import io.mockdispatch.core.model.ConditionOperator;
import io.mockdispatch.core.model.ConditionType;
import io.mockdispatch.core.model.ConditionalResponseRule;
import io.mockdispatch.core.model.CustomApiDefinition;
import io.mockdispatch.core.model.FieldSpec;
import io.mockdispatch.core.model.FieldType;
import io.mockdispatch.core.model.QueryParamSpec;
import io.mockdispatch.core.model.ResourceDefinition;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses a definitions document (YAML or JSON, YAML being a superset) into a
 * {@link DefinitionRegistry}.
 *
 * <pre>{@code
 * apis:
 *   - id: get-user
 *     method: GET
 *     path: /users/:id
 *     statusCode: 200
 *     responseBody: {id: 1, name: Ada}
 * resources:
 *   - id: r-users
 *     name: users
 *     seed: 20
 *     fields:
 *       - {name: name, type: string, hint: person.fullName, required: true}
 * }</pre>
 *
 * <p>
 * Every problem is reported as a {@link DefinitionParseException} naming the source and the
 * offending entry. Thread-safe.
 */
public final class DefinitionParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Resource names double as a URL segment and a store key. */
    private static final Pattern RESOURCE_NAME = Pattern.compile("^[a-z][a-z0-9_-]*$");

    /**
     * Parses the document at the given path.
     *
     * @throws DefinitionParseException if the file cannot be read or is invalid
     */
    public DefinitionRegistry parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        if (!Files.exists(path)) {
            throw new DefinitionParseException("Definitions file not found: " + path, source);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parse(YAML_MAPPER.readTree(in), source);
        } catch (IOException e) {
            throw new DefinitionParseException("Failed to parse definitions: " + e.getMessage(), e, source);
        }
    }

    /**
     * Parses a document from a string, e.g. a test fixture.
     *
     * @param document YAML or JSON text
     * @param source   label used in error messages
     */
    public DefinitionRegistry parse(String document, String source) {
        try {
            return parse(YAML_MAPPER.readTree(document), source);
        } catch (IOException e) {
            throw new DefinitionParseException("Failed to parse definitions: " + e.getMessage(), e, source);
        }
    }

    DefinitionRegistry parse(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return DefinitionRegistry.empty();
        }
        if (!root.isObject()) {
            throw new DefinitionParseException("Definitions document must be a mapping", source);
        }

        List<CustomApiDefinition> apis = new ArrayList<>();
        Set<String> apiIds = new HashSet<>();
        for (JsonNode node : listOf(root, "apis", source)) {
            CustomApiDefinition api = parseApi(node, source);
            if (!apiIds.add(api.id())) {
                throw new DefinitionParseException("Duplicate custom API id '" + api.id() + "'", source);
            }
            apis.add(api);
        }

        List<ResourceDefinition> resources = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (JsonNode node : listOf(root, "resources", source)) {
            ResourceDefinition resource = parseResource(node, source);
            if (!names.add(resource.name())) {
                throw new DefinitionParseException("Duplicate resource name '" + resource.name() + "'", source);
            }
            resources.add(resource);
        }

        return new DefinitionRegistry(apis, resources);
    }

    private CustomApiDefinition parseApi(JsonNode node, String source) {
        String id = requireText(node, "id", "custom API", source);
        String context = "custom API '" + id + "'";

        String method = requireText(node, "method", context, source).toUpperCase(Locale.ROOT);
        if (!CustomApiDefinition.METHODS.contains(method)) {
            throw new DefinitionParseException(context + ": unsupported method '" + method + "'", source);
        }
        String path = requireText(node, "path", context, source);
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        int statusCode = node.has("statusCode") ? statusCode(node.get("statusCode"), context, source) : 200;

        List<QueryParamSpec> queryParams = new ArrayList<>();
        for (JsonNode param : listOf(node, "queryParams", source)) {
            queryParams.add(new QueryParamSpec(
                    param.path("key").asText(), param.path("value").asText(null), param.path("required").asBoolean(false)));
        }

        ConditionalResponseRule rule = null;
        JsonNode conditional = node.get("conditionalResponse");
        if (conditional != null && !conditional.isNull()) {
            rule = parseRule(conditional, context, source);
        }

        return new CustomApiDefinition(
                id,
                textOrNull(node, "name"),
                method,
                path,
                statusCode,
                node.get("responseBody"),
                textOrNull(node, "webhookUrl"),
                queryParams,
                rule);
    }

    private ConditionalResponseRule parseRule(JsonNode node, String context, String source) {
        JsonNode conditionNode = node.get("condition");
        if (conditionNode == null || !conditionNode.isObject()) {
            throw new DefinitionParseException(context + ": conditionalResponse.condition is required", source);
        }
        ConditionType type;
        ConditionOperator operator;
        try {
            type = ConditionType.fromId(requireText(conditionNode, "type", context, source));
            operator = ConditionOperator.fromId(requireText(conditionNode, "operator", context, source));
        } catch (IllegalArgumentException e) {
            throw new DefinitionParseException(context + ": " + e.getMessage(), source);
        }
        String dependentApiId = textOrNull(conditionNode, "dependentApiId");
        if (type == ConditionType.DEPENDENT_API && dependentApiId == null) {
            throw new DefinitionParseException(context + ": dependentApi condition needs dependentApiId", source);
        }
        String key = textOrNull(conditionNode, "key");
        if (type != ConditionType.DEPENDENT_API && key == null) {
            throw new DefinitionParseException(context + ": " + type.id() + " condition needs a key", source);
        }

        Condition condition = new Condition(
                type,
                key,
                operator,
                conditionNode.get("value"),
                dependentApiId,
                textOrNull(conditionNode, "dependentApiPath"));

        return new ConditionalResponseRule(
                condition,
                node.get("responseIfTrue"),
                node.get("responseIfFalse"),
                node.hasNonNull("statusCodeIfTrue")
                        ? statusCode(node.get("statusCodeIfTrue"), context, source)
                        : null,
                node.hasNonNull("statusCodeIfFalse")
                        ? statusCode(node.get("statusCodeIfFalse"), context, source)
                        : null);
    }

    private ResourceDefinition parseResource(JsonNode node, String source) {
        String id = requireText(node, "id", "resource", source);
        String context = "resource '" + id + "'";
        String name = requireText(node, "name", context, source).trim().toLowerCase(Locale.ROOT);
        if (name.contains("/")) {
            throw new DefinitionParseException(
                    context + ": resource name cannot contain slashes, use a custom API for multi-segment paths",
                    source);
        }
        if (!RESOURCE_NAME.matcher(name).matches()) {
            throw new DefinitionParseException(
                    context + ": resource name must start with a letter and contain only letters, digits, '-' or '_'",
                    source);
        }

        List<FieldSpec> fields = new ArrayList<>();
        for (JsonNode field : listOf(node, "fields", source)) {
            String fieldName = requireText(field, "name", context + " field", source);
            FieldType type;
            try {
                type = FieldType.fromId(requireText(field, "type", context + " field '" + fieldName + "'", source));
            } catch (IllegalArgumentException e) {
                throw new DefinitionParseException(context + ": " + e.getMessage(), source);
            }
            String hint = textOrNull(field, "hint");
            if (hint == null) {
                hint = textOrNull(field, "fakerMethod");
            }
            fields.add(new FieldSpec(
                    fieldName, type, hint, textOrNull(field, "relationTo"), field.path("required").asBoolean(false)));
        }

        int seed = node.path("seed").asInt(0);
        if (seed < 0) {
            throw new DefinitionParseException(context + ": seed must not be negative", source);
        }
        return new ResourceDefinition(id, name, fields, seed);
    }

    // --- helpers ---

    private static Iterable<JsonNode> listOf(JsonNode parent, String field, String source) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new DefinitionParseException("'" + field + "' must be a list", source);
        }
        return node;
    }

    private static String requireText(JsonNode node, String field, String context, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            throw new DefinitionParseException(context + ": missing required field '" + field + "'", source);
        }
        return value.asText();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    private static int statusCode(JsonNode node, String context, String source) {
        if (!node.canConvertToInt() && !node.isTextual()) {
            throw new DefinitionParseException(context + ": status code must be a number", source);
        }
        int code;
        try {
            code = node.isTextual() ? Integer.parseInt(node.asText().trim()) : node.asInt();
        } catch (NumberFormatException e) {
            throw new DefinitionParseException(context + ": status code must be a number", source);
        }
        if (code < 100 || code > 599) {
            throw new DefinitionParseException(context + ": status code " + code + " outside 100..599", source);
        }
        return code;
    }
}
