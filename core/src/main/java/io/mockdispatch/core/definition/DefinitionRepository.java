package io.mockdispatch.core.definition;

/**
 * Boundary to wherever custom API and resource definitions are kept.
 *
 * <p>
 * The dispatcher only reads: it captures one {@link DefinitionRegistry} snapshot per request.
 * Creating, editing and deleting definitions is the repository owner's concern.
 */
public interface DefinitionRepository {

    /** The current definitions snapshot, never null. */
    DefinitionRegistry current();
}
