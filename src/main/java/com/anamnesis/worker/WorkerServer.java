package com.anamnesis.worker;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The worker end of a channel: reads call frames until the input ends, handles calls concurrently and
 * writes each response as one frame as soon as it is ready.
 */
public class WorkerServer {
    private static final Logger log = LoggerFactory.getLogger(WorkerServer.class);
    private static final long DRAIN_SECONDS = 30;

    private final WorkerHandler handler;
    private final InputStream input;
    private final OutputStream output;
    private final FrameCodec codec;
    private final ObjectMapper mapper;
    private final ExecutorService executor;
    private final Object writeLock = new Object();

    public WorkerServer(WorkerHandler handler, InputStream input, OutputStream output, int maxFrameBytes, int concurrency) {
        this.handler = handler;
        this.input = input;
        this.output = output;
        this.codec = new FrameCodec(maxFrameBytes);
        this.mapper = WorkerProtocol.mapper();
        this.executor = Executors.newFixedThreadPool(Math.max(1, concurrency), runnable -> {
            Thread thread = new Thread(runnable, "worker-call");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Serves until the input ends cleanly. In-flight calls are allowed to finish before returning.
     *
     * @throws IOException when the input breaks mid-frame or carries an oversized frame
     */
    public void serve() throws IOException {
        log.info("worker.serving");
        try {
            while (true) {
                byte[] frame = codec.read(input);
                if (frame == null) {
                    break;
                }
                executor.execute(() -> handleFrame(frame));
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(DRAIN_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("worker.drain.timeout seconds={}", DRAIN_SECONDS);
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("worker.stopped");
        }
    }

    private void handleFrame(byte[] frame) {
        JsonNode tree;
        try {
            tree = mapper.readTree(frame);
        } catch (IOException e) {
            log.warn("worker.call.undecodable reason={}", e.getMessage());
            return;
        }
        if (tree == null || !tree.path("id").canConvertToLong()) {
            log.warn("worker.call.without-id dropped");
            return;
        }
        long id = tree.path("id").asLong();
        WorkerResponse response;
        try {
            CallEnvelope call = mapper.treeToValue(tree, CallEnvelope.class);
            if (call.request() == null) {
                throw new WorkerCallException(new WorkerError(WorkerError.MALFORMED_REQUEST, "call carries no request"));
            }
            response = WorkerResponse.success(id, mapper.valueToTree(handler.handle(call.request())));
        } catch (JsonProcessingException e) {
            response = WorkerResponse.failure(id, new WorkerError(WorkerError.MALFORMED_REQUEST, e.getOriginalMessage()));
        } catch (WorkerCallException e) {
            response = WorkerResponse.failure(id, e.error());
        } catch (RuntimeException e) {
            log.error("worker.call.failed id={}", id, e);
            response = WorkerResponse.failure(id, new WorkerError(WorkerError.INTERNAL, String.valueOf(e.getMessage())));
        }
        write(response);
    }

    private void write(WorkerResponse response) {
        try {
            byte[] payload = mapper.writeValueAsBytes(response);
            synchronized (writeLock) {
                codec.write(output, payload);
            }
        } catch (FrameTooLargeException e) {
            log.warn("worker.response.too-large id={} bytes={}", response.id(), e.length());
            writeError(response.id(), new WorkerError(WorkerError.INTERNAL, e.getMessage()));
        } catch (IOException e) {
            log.error("worker.response.write.failed id={} reason={}", response.id(), e.getMessage());
        }
    }

    private void writeError(long id, WorkerError error) {
        try {
            byte[] payload = mapper.writeValueAsBytes(WorkerResponse.failure(id, error));
            synchronized (writeLock) {
                codec.write(output, payload);
            }
        } catch (IOException e) {
            log.error("worker.response.write.failed id={} reason={}", id, e.getMessage());
        }
    }
}
