package io.mockdispatch.core.generate;

import io.mockdispatch.core.store.RecordStore;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import net.datafaker.Faker;

/**
 * Inputs shared by every {@link FieldValueGenerator} during one generation run.
 *
 * @param random source of randomness
 * @param clock  reference time for dates
 * @param store  collections that relation fields draw ids from
 * @param faker  fake-data provider drawing from {@code random}
 */
public record GenerationContext(Random random, Clock clock, RecordStore store, Faker faker) {

    public GenerationContext(Random random, Clock clock, RecordStore store) {
        this(random, clock, store, new Faker(Locale.ENGLISH, random));
    }

    /** Uniformly picks one element of a non-empty list. */
    public <T> T pick(List<T> values) {
        return values.get(random.nextInt(values.size()));
    }
}
