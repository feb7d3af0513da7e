package io.mockdispatch.core.generate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.mockdispatch.core.model.FieldType;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Registry of one {@link FieldValueGenerator} per {@link FieldType}.
 *
 * <p>
 * {@link #defaults()} covers every field type. Generators can be replaced per type with
 * {@link #register}. Not thread-safe while being configured; safe to share once built.
 */
public final class FieldGenerators {

    static final Duration DATE_WINDOW = Duration.ofDays(30);

    private final Map<FieldType, FieldValueGenerator> generators = new EnumMap<>(FieldType.class);

    private FieldGenerators() {}

    /** Generators for all built-in field types. */
    public static FieldGenerators defaults() {
        FieldGenerators table = new FieldGenerators();
        table.register(FieldType.STRING, new StringFieldGenerator());
        table.register(FieldType.NUMBER, (field, ctx) -> IntNode.valueOf(1 + ctx.random().nextInt(1000)));
        table.register(FieldType.BOOLEAN, (field, ctx) -> BooleanNode.valueOf(ctx.random().nextBoolean()));
        table.register(FieldType.DATE, (field, ctx) -> {
            Instant now = ctx.clock().instant();
            long offset = (long) (ctx.random().nextDouble() * DATE_WINDOW.toMillis());
            return TextNode.valueOf(now.minusMillis(offset).toString());
        });
        table.register(FieldType.EMAIL, (field, ctx) -> TextNode.valueOf(ctx.faker().internet().emailAddress()));
        table.register(FieldType.UUID, (field, ctx) -> TextNode.valueOf(randomUuid(ctx).toString()));
        table.register(FieldType.IMAGE, (field, ctx) ->
                TextNode.valueOf("https://picsum.photos/seed/" + Integer.toHexString(ctx.random().nextInt())
                        + "/640/480"));
        table.register(FieldType.RELATION, (field, ctx) -> {
            if (field.relationTo() == null) {
                return NullNode.getInstance();
            }
            Optional<List<ObjectNode>> related = ctx.store().get(field.relationTo());
            if (related.isEmpty() || related.get().isEmpty()) {
                return NullNode.getInstance();
            }
            JsonNode id = ctx.pick(related.get()).get("id");
            return id != null ? id.deepCopy() : NullNode.getInstance();
        });
        return table;
    }

    /** Replaces the generator for a type. */
    public FieldGenerators register(FieldType type, FieldValueGenerator generator) {
        generators.put(type, generator);
        return this;
    }

    /**
     * @throws IllegalArgumentException if no generator is registered for the type
     */
    public FieldValueGenerator get(FieldType type) {
        FieldValueGenerator generator = generators.get(type);
        if (generator == null) {
            throw new IllegalArgumentException("No generator registered for field type: " + type.id());
        }
        return generator;
    }

    /** Version 4 UUID drawn from the context's random source, so seeded runs are repeatable. */
    static UUID randomUuid(GenerationContext ctx) {
        long msb = (ctx.random().nextLong() & 0xffffffffffff0fffL) | 0x0000000000004000L;
        long lsb = (ctx.random().nextLong() & 0x3fffffffffffffffL) | 0x8000000000000000L;
        return new UUID(msb, lsb);
    }
}
