package io.mockdispatch.core.generate;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mockdispatch.core.definition.DefinitionRegistry;
import io.mockdispatch.core.model.FieldSpec;
import io.mockdispatch.core.model.ResourceDefinition;
import io.mockdispatch.core.store.RecordStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces fake records for a resource from its field schema.
 *
 * <p>
 * Each record is {@code {"id": <uuid>, <field>: <value>, ...}} with fields in declaration
 * order. Relation fields draw ids from collections already in the store, so resources should be
 * generated parents first.
 */
public final class RecordGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(RecordGenerator.class);

    /** Largest count accepted by {@link #generate}. */
    public static final int MAX_COUNT = 1000;

    private final FieldGenerators generators;
    private final Random random;
    private final Clock clock;

    public RecordGenerator() {
        this(FieldGenerators.defaults(), new Random(), Clock.systemUTC());
    }

    public RecordGenerator(FieldGenerators generators, Random random, Clock clock) {
        this.generators = Objects.requireNonNull(generators, "generators must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Generates records without storing them.
     *
     * @param store source of related collections for relation fields
     * @throws IllegalArgumentException if {@code count} is outside {@code 0..MAX_COUNT}
     */
    public List<ObjectNode> generate(ResourceDefinition resource, int count, RecordStore store) {
        if (count < 0 || count > MAX_COUNT) {
            throw new IllegalArgumentException("count must be between 0 and " + MAX_COUNT + ", got " + count);
        }
        GenerationContext context = new GenerationContext(random, clock, store);
        List<ObjectNode> records = new ArrayList<>(count);
        synchronized (random) {
            for (int i = 0; i < count; i++) {
                ObjectNode record = JsonNodeFactory.instance.objectNode();
                record.put("id", FieldGenerators.randomUuid(context).toString());
                for (FieldSpec field : resource.fields()) {
                    record.set(field.name(), generators.get(field.type()).generate(field, context));
                }
                records.add(record);
            }
        }
        return records;
    }

    /** Generates records and replaces the resource's collection with them. */
    public List<ObjectNode> generateInto(RecordStore store, ResourceDefinition resource, int count) {
        List<ObjectNode> records = generate(resource, count, store);
        store.replace(resource.name(), records);
        LOG.info("Generated {} records for resource '{}'", records.size(), resource.name());
        return records;
    }

    /**
     * Generates {@code seed} records for every resource that declares a positive seed and has
     * no stored collection yet, in declaration order.
     *
     * @return number of collections created
     */
    public int seed(DefinitionRegistry registry, RecordStore store) {
        int seeded = 0;
        for (ResourceDefinition resource : registry.resources()) {
            if (resource.seed() > 0 && !store.exists(resource.name())) {
                generateInto(store, resource, Math.min(resource.seed(), MAX_COUNT));
                seeded++;
            }
        }
        return seeded;
    }
}
