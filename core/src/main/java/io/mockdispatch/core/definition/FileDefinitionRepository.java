package io.mockdispatch.core.definition;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Definition repository backed by one definitions document on disk.
 *
 * <p>
 * Holds the current {@link DefinitionRegistry} in an {@link AtomicReference}. {@link #reload()}
 * parses the file into a fresh registry and swaps it in; if parsing fails the previous snapshot
 * stays active and the exception propagates to the caller.
 */
public final class FileDefinitionRepository implements DefinitionRepository {

    private static final Logger LOG = LoggerFactory.getLogger(FileDefinitionRepository.class);

    private final Path file;
    private final DefinitionParser parser;
    private final AtomicReference<DefinitionRegistry> registryRef =
            new AtomicReference<>(DefinitionRegistry.empty());

    public FileDefinitionRepository(Path file, DefinitionParser parser) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /**
     * Creates a repository and performs the initial load.
     *
     * @throws io.mockdispatch.core.error.DefinitionParseException if the file is invalid
     */
    public static FileDefinitionRepository load(Path file) {
        FileDefinitionRepository repository = new FileDefinitionRepository(file, new DefinitionParser());
        repository.reload();
        return repository;
    }

    @Override
    public DefinitionRegistry current() {
        return registryRef.get();
    }

    /**
     * Re-reads the definitions file and atomically swaps the snapshot.
     *
     * @return the new snapshot
     * @throws io.mockdispatch.core.error.DefinitionParseException if the file is invalid; the
     *                                                             previous snapshot stays active
     */
    public DefinitionRegistry reload() {
        DefinitionRegistry fresh = parser.parse(file);
        DefinitionRegistry previous = registryRef.getAndSet(fresh);
        LOG.info(
                "Definitions loaded from {}: apis={}, resources={} (previously apis={}, resources={})",
                file,
                fresh.apis().size(),
                fresh.resources().size(),
                previous.apis().size(),
                previous.resources().size());
        return fresh;
    }

    public Path file() {
        return file;
    }
}
