package io.github.genie.flake.core.support;

import java.util.concurrent.locks.LockSupport;

@FunctionalInterface
public interface Sleeper {

    // parkNanos returns at once while the thread's interrupt flag is set
    Sleeper DEFAULT = LockSupport::parkNanos;

    void sleep(long nanos);

}
