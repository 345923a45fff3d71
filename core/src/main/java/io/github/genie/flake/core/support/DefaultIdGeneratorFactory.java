package io.github.genie.flake.core.support;

import io.github.genie.flake.core.IdGenerator;
import io.github.genie.flake.core.IdGeneratorFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link FlakeIdGenerator} per key, all built from the same config.
 * IDs are unique within a key only.
 */
public class DefaultIdGeneratorFactory implements IdGeneratorFactory {

    private final Map<String, IdGenerator> generators = new ConcurrentHashMap<>();
    private final GeneratorConfig config;

    public DefaultIdGeneratorFactory() {
        this(new GeneratorConfig());
    }

    public DefaultIdGeneratorFactory(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public IdGenerator getIdGenerator(String key) {
        Objects.requireNonNull(key, "key");
        return generators.computeIfAbsent(key, this::newGenerator);
    }

    private IdGenerator newGenerator(String key) {
        FlakeIdGenerator generator = FlakeIdGenerator.create(config);
        if (generator == null) {
            throw new IllegalStateException("epoch " + config.getEpoch() + " is in the future, key: " + key);
        }
        return generator;
    }

}
