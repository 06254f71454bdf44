package com.anamnesis.worker;

import java.io.IOException;

public interface WorkerChannelFactory {
    /**
     * Spawns a worker of the given kind and returns a started channel to it.
     */
    WorkerChannel open(WorkerKind kind) throws IOException;
}
