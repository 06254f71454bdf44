package com.anamnesis.runtime;

import java.io.IOException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.anamnesis.pipeline.IngestionCoordinator;
import com.anamnesis.pipeline.IngestionLimits;
import com.anamnesis.store.TriplestoreClient;
import com.anamnesis.worker.WorkerChannelFactory;
import com.anamnesis.worker.WorkerKind;
import com.anamnesis.worker.WorkerPool;

/**
 * Pools for every worker kind plus the coordinator that uses them, built from configuration.
 */
public class IngestionRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionRuntime.class);

    private final Map<WorkerKind, WorkerPool> pools;
    private final IngestionCoordinator coordinator;

    private IngestionRuntime(Map<WorkerKind, WorkerPool> pools, IngestionCoordinator coordinator) {
        this.pools = pools;
        this.coordinator = coordinator;
    }

    public static IngestionRuntime start(AppConfig config, WorkerChannelFactory factory, TriplestoreClient store) throws IOException {
        Map<WorkerKind, WorkerPool> pools = new EnumMap<>(WorkerKind.class);
        Map<WorkerKind, Duration> checkout = new EnumMap<>(WorkerKind.class);
        try {
            for (WorkerKind kind : WorkerKind.values()) {
                AppConfig.PoolConfig poolConfig = config.getWorkers().pool(kind);
                WorkerPool pool = new WorkerPool(kind, factory, poolConfig.getSize(), poolConfig.getMaxRestarts(),
                        Duration.ofMillis(poolConfig.getRestartWindowMs()));
                pools.put(kind, pool);
                pool.start();
                checkout.put(kind, Duration.ofMillis(poolConfig.getCheckoutTimeoutMs()));
            }
        } catch (IOException | RuntimeException e) {
            pools.values().forEach(WorkerPool::close);
            throw e;
        }
        IngestionLimits limits = new IngestionLimits(
                Duration.ofMillis(config.getIngestion().getTimeoutMs()),
                Duration.ofMillis(config.getWorkers().getCallTimeoutMs()),
                checkout);
        IngestionCoordinator coordinator = new IngestionCoordinator(pools, store, config.getStore().getEndpoint(), limits);
        log.info("runtime.started pools={} endpoint={}", pools.values(), config.getStore().getEndpoint());
        return new IngestionRuntime(pools, coordinator);
    }

    public IngestionCoordinator coordinator() {
        return coordinator;
    }

    public WorkerPool pool(WorkerKind kind) {
        return pools.get(kind);
    }

    @Override
    public void close() {
        pools.values().forEach(WorkerPool::close);
    }
}
