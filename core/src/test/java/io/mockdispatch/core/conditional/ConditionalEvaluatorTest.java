package io.mockdispatch.core.conditional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.mockdispatch.core.definition.DefinitionRegistry;
import io.mockdispatch.core.model.Condition;
import io.mockdispatch.core.model.ConditionOperator;
import io.mockdispatch.core.model.ConditionalResponseRule;
import io.mockdispatch.core.model.CustomApiDefinition;
import io.mockdispatch.core.model.MockRequest;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConditionalEvaluatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ConditionalEvaluator evaluator = new ConditionalEvaluator();

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static ConditionalResponseRule rule(Condition condition) {
        return new ConditionalResponseRule(condition, json("{\"branch\":\"yes\"}"), json("{\"branch\":\"no\"}"), 201, null);
    }

    private static CustomApiDefinition api(String id, Condition condition, JsonNode ifTrue, JsonNode ifFalse) {
        return new CustomApiDefinition(
                id,
                null,
                "GET",
                "/" + id,
                200,
                json("{}"),
                null,
                List.of(),
                new ConditionalResponseRule(condition, ifTrue, ifFalse, null, null));
    }

    private static EvaluationContext context(MockRequest request, String body, DefinitionRegistry registry) {
        return EvaluationContext.root(request, body == null ? null : json(body), registry, "served");
    }

    private static EvaluationContext context(MockRequest request) {
        return context(request, null, DefinitionRegistry.empty());
    }

    @Nested
    @DisplayName("Request conditions")
    class RequestConditions {

        @Test
        @DisplayName("header exists on a request without the header picks the false branch")
        void missingHeaderIsFalse() {
            ConditionalOutcome outcome = evaluator.evaluate(
                    rule(Condition.header("Authorization", ConditionOperator.EXISTS, null)),
                    200,
                    context(MockRequest.of("GET", "/x")));

            assertThat(outcome.matched()).isFalse();
            assertThat(outcome.body().get("branch").asText()).isEqualTo("no");
            assertThat(outcome.statusCode()).isEqualTo(200);
        }

        @Test
        void headerNameIsCaseInsensitive() {
            MockRequest request = new MockRequest("GET", "/x", Map.of(), Map.of("Authorization", "Bearer t"), null);

            ConditionalOutcome outcome = evaluator.evaluate(
                    rule(Condition.header("authorization", ConditionOperator.CONTAINS, TextNode.valueOf("Bearer"))),
                    200,
                    context(request));

            assertThat(outcome.matched()).isTrue();
            assertThat(outcome.statusCode()).isEqualTo(201);
        }

        @Test
        void queryEqualsComparesNumbersLoosely() {
            MockRequest request = new MockRequest("GET", "/x", Map.of("tier", List.of("1", "2")), Map.of(), null);

            assertThat(evaluator.test(Condition.query("tier", ConditionOperator.EQUALS, IntNode.valueOf(2)), context(request)))
                    .isTrue();
            assertThat(evaluator.test(
                            Condition.query("tier", ConditionOperator.NOT_EQUALS, IntNode.valueOf(2)), context(request)))
                    .isFalse();
        }

        @Test
        void bodyPathWithArrayIndex() {
            EvaluationContext ctx = context(
                    MockRequest.of("POST", "/x"), "{\"order\":{\"items\":[{\"qty\":5}]}}", DefinitionRegistry.empty());

            assertThat(evaluator.test(
                            Condition.body("order.items.0.qty", ConditionOperator.GREATER_THAN, IntNode.valueOf(3)), ctx))
                    .isTrue();
            assertThat(evaluator.test(
                            Condition.body("order.items.0.qty", ConditionOperator.LESS_THAN, IntNode.valueOf(3)), ctx))
                    .isFalse();
            assertThat(evaluator.test(Condition.body("order.missing", ConditionOperator.EXISTS, null), ctx))
                    .isFalse();
        }

        @Test
        void orderingOnNonNumericValuesIsFalse() {
            EvaluationContext ctx = context(MockRequest.of("POST", "/x"), "{\"name\":\"ann\"}", DefinitionRegistry.empty());

            assertThat(evaluator.test(Condition.body("name", ConditionOperator.GREATER_THAN, IntNode.valueOf(1)), ctx))
                    .isFalse();
            assertThat(evaluator.test(Condition.body("name", ConditionOperator.LESS_THAN, IntNode.valueOf(1)), ctx))
                    .isFalse();
        }

        @Test
        void containsOnArrayMatchesElements() {
            EvaluationContext ctx = context(MockRequest.of("POST", "/x"), "{\"roles\":[\"admin\",\"dev\"]}", DefinitionRegistry.empty());

            assertThat(evaluator.test(Condition.body("roles", ConditionOperator.CONTAINS, TextNode.valueOf("dev")), ctx))
                    .isTrue();
            assertThat(evaluator.test(Condition.body("roles", ConditionOperator.CONTAINS, TextNode.valueOf("de")), ctx))
                    .isFalse();
        }

        @Test
        void bodyConditionWithoutBodyIsFalse() {
            assertThat(evaluator.test(
                            Condition.body("a", ConditionOperator.EQUALS, TextNode.valueOf("b")),
                            context(MockRequest.of("GET", "/x"))))
                    .isFalse();
        }
    }

    @Nested
    @DisplayName("Dependent APIs")
    class DependentApis {

        @Test
        void readsDependentResponseBody() {
            CustomApiDefinition flags = CustomApiDefinition.of("flags", "GET", "/flags", 200, json("{\"beta\":true}"));
            DefinitionRegistry registry = new DefinitionRegistry(List.of(flags), List.of());

            boolean result = evaluator.test(
                    Condition.dependentApi("flags", "beta", ConditionOperator.EQUALS, json("true")),
                    context(MockRequest.of("GET", "/x"), null, registry));

            assertThat(result).isTrue();
        }

        @Test
        void unknownDependentApiIsFalse() {
            assertThat(evaluator.test(
                            Condition.dependentApi("nope", "a", ConditionOperator.EXISTS, null),
                            context(MockRequest.of("GET", "/x"))))
                    .isFalse();
        }

        @Test
        void dependentApiSeesTheSameRequest() {
            CustomApiDefinition gate = api(
                    "gate",
                    Condition.header("x-tenant", ConditionOperator.EQUALS, TextNode.valueOf("acme")),
                    json("{\"allowed\":true}"),
                    json("{\"allowed\":false}"));
            DefinitionRegistry registry = new DefinitionRegistry(List.of(gate), List.of());
            MockRequest request = new MockRequest("GET", "/x", Map.of(), Map.of("X-Tenant", "acme"), null);

            assertThat(evaluator.test(
                            Condition.dependentApi("gate", "allowed", ConditionOperator.EQUALS, json("true")),
                            context(request, null, registry)))
                    .isTrue();
        }

        @Test
        @DisplayName("An API depending on itself evaluates to false")
        void selfCycleIsFalse() {
            CustomApiDefinition self = api(
                    "self",
                    Condition.dependentApi("self", "ok", ConditionOperator.EXISTS, null),
                    json("{\"ok\":1}"),
                    json("{\"fallback\":true}"));
            DefinitionRegistry registry = new DefinitionRegistry(List.of(self), List.of());

            ConditionalOutcome outcome = evaluator.respond(
                    self, EvaluationContext.root(MockRequest.of("GET", "/self"), null, registry, "self"));

            assertThat(outcome.matched()).isFalse();
            assertThat(outcome.body().get("fallback").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("A -> B -> A terminates with the false branch")
        void mutualCycleIsFalse() {
            CustomApiDefinition a = api(
                    "a",
                    Condition.dependentApi("b", "ok", ConditionOperator.EQUALS, json("true")),
                    json("{\"ok\":true}"),
                    json("{\"ok\":false}"));
            CustomApiDefinition b = api(
                    "b",
                    Condition.dependentApi("a", "ok", ConditionOperator.EQUALS, json("true")),
                    json("{\"ok\":true}"),
                    json("{\"ok\":false}"));
            DefinitionRegistry registry = new DefinitionRegistry(List.of(a, b), List.of());

            ConditionalOutcome outcome =
                    evaluator.respond(a, EvaluationContext.root(MockRequest.of("GET", "/a"), null, registry, "a"));

            assertThat(outcome.matched()).isFalse();
        }

        @Test
        @DisplayName("Chains deeper than the configured depth evaluate to false")
        void depthLimit() {
            CustomApiDefinition leaf = CustomApiDefinition.of("leaf", "GET", "/leaf", 200, json("{\"ok\":true}"));
            CustomApiDefinition middle = api(
                    "middle",
                    Condition.dependentApi("leaf", "ok", ConditionOperator.EQUALS, json("true")),
                    json("{\"ok\":true}"),
                    json("{\"ok\":false}"));
            CustomApiDefinition top = api(
                    "top",
                    Condition.dependentApi("middle", "ok", ConditionOperator.EQUALS, json("true")),
                    json("{\"ok\":true}"),
                    json("{\"ok\":false}"));
            DefinitionRegistry registry = new DefinitionRegistry(List.of(leaf, middle, top), List.of());
            EvaluationContext ctx = EvaluationContext.root(MockRequest.of("GET", "/top"), null, registry, "top");

            assertThat(new ConditionalEvaluator(1).respond(top, ctx).matched()).isFalse();
            assertThat(new ConditionalEvaluator(5).respond(top, ctx).matched()).isTrue();
        }
    }

    @Test
    void apiWithoutRuleUsesStoredResponse() {
        CustomApiDefinition plain = CustomApiDefinition.of("p", "DELETE", "/p", 204, NullNode.getInstance());

        ConditionalOutcome outcome = evaluator.respond(plain, context(MockRequest.of("DELETE", "/p")));

        assertThat(outcome.statusCode()).isEqualTo(204);
        assertThat(outcome.body().isNull()).isTrue();
        assertThat(outcome.matched()).isFalse();
    }

    @Test
    void rejectsNonPositiveDepth() {
        assertThatThrownBy(() -> new ConditionalEvaluator(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
