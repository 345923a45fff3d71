package io.github.genie.flake.core;

public interface IdGeneratorFactory {

    /**
     * IDs are unique within a key only, generators of different keys may
     * issue the same value.
     */
    default long nextId(String key) {
        return getIdGenerator(key).nextId();
    }

    default String nextEncodedId(String key) {
        return getIdGenerator(key).nextEncodedId();
    }

    IdGenerator getIdGenerator(String key);

}
