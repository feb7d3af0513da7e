package io.mockdispatch.core.generate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.mockdispatch.core.model.FieldSpec;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hint-driven string values.
 *
 * <p>
 * A hint is a faker path such as {@code internet.userName} or {@code commerce.productName},
 * resolved as a Datafaker expression. The {@code person} and {@code location} namespaces are
 * accepted as aliases of Datafaker's {@code name} and {@code address}. A missing or unresolvable
 * hint yields a lorem word.
 */
final class StringFieldGenerator implements FieldValueGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(StringFieldGenerator.class);

    private static final Map<String, String> HINT_ALIASES = Map.of(
            "person.jobtitle", "job.title",
            "person.bio", "lorem.sentence",
            "location.zipcode", "address.zipCode",
            "location.state", "address.state");

    private static final Map<String, String> NAMESPACE_ALIASES = Map.of(
            "person", "name",
            "location", "address");

    @Override
    public JsonNode generate(FieldSpec field, GenerationContext context) {
        return TextNode.valueOf(value(field.hint(), context));
    }

    static String value(String hint, GenerationContext context) {
        if (hint == null || hint.isBlank()) {
            return context.faker().lorem().word();
        }
        String path = fakerPath(hint.trim());
        String value = resolve(path, context);
        if (value == null) {
            // Datafaker spells some accessors in lower case, e.g. internet.username
            int dot = path.lastIndexOf('.');
            String lowered = path.substring(0, dot + 1) + path.substring(dot + 1).toLowerCase(Locale.ROOT);
            value = lowered.equals(path) ? null : resolve(lowered, context);
        }
        if (value == null) {
            LOG.debug("Hint '{}' did not resolve, using a lorem word", hint);
            return context.faker().lorem().word();
        }
        return value;
    }

    private static String resolve(String path, GenerationContext context) {
        String expression = "#{" + path + "}";
        try {
            String value = context.faker().expression(expression);
            return value == null || value.isBlank() || value.equals(expression) ? null : value;
        } catch (RuntimeException e) {
            LOG.trace("Expression {} failed: {}", expression, e.getMessage());
            return null;
        }
    }

    static String fakerPath(String hint) {
        String alias = HINT_ALIASES.get(hint.toLowerCase(Locale.ROOT));
        if (alias != null) {
            return alias;
        }
        int dot = hint.indexOf('.');
        if (dot <= 0) {
            return hint;
        }
        String namespace = NAMESPACE_ALIASES.get(hint.substring(0, dot).toLowerCase(Locale.ROOT));
        return namespace == null ? hint : namespace + hint.substring(dot);
    }
}
