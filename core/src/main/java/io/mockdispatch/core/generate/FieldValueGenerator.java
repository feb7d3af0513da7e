package io.mockdispatch.core.generate;

import com.fasterxml.jackson.databind.JsonNode;
import io.mockdispatch.core.model.FieldSpec;

/** Produces a value for one field of a generated record. */
@FunctionalInterface
public interface FieldValueGenerator {

    /**
     * @param field   the field being generated
     * @param context randomness, clock and related collections
     * @return the value, JSON null when nothing sensible can be produced
     */
    JsonNode generate(FieldSpec field, GenerationContext context);
}
