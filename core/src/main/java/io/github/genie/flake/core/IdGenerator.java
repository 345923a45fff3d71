package io.github.genie.flake.core;

import io.github.genie.flake.core.codec.Base62;

public interface IdGenerator {

    long nextId();

    default String nextEncodedId() {
        return Base62.encode(nextId());
    }

}
