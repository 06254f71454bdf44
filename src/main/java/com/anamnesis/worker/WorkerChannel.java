package com.anamnesis.worker;

import java.io.IOException;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Multiplexes concurrent calls over one worker's framed stream pair. Calls are correlated by an id that
 * is never reused on the channel; responses may arrive in any order. Once closed, a channel stays closed.
 */
public class WorkerChannel implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerChannel.class);

    private final String name;
    private final WorkerTransport transport;
    private final FrameCodec codec;
    private final ObjectMapper mapper;
    private final Object writeLock = new Object();
    private final AtomicLong nextId = new AtomicLong();
    private final Map<Long, CompletableFuture<WorkerResponse>> pending = new ConcurrentHashMap<>();
    private final Set<Long> abandoned = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final List<Consumer<WorkerChannel>> closeListeners = new CopyOnWriteArrayList<>();
    private volatile String closeReason = "not closed";
    private Thread reader;

    public WorkerChannel(String name, WorkerTransport transport, FrameCodec codec, ObjectMapper mapper) {
        this.name = name;
        this.transport = transport;
        this.codec = codec;
        this.mapper = mapper;
    }

    public synchronized WorkerChannel start() {
        if (reader == null) {
            reader = new Thread(this::readLoop, "worker-channel-" + name);
            reader.setDaemon(true);
            reader.start();
            log.debug("channel.started channel={} transport={}", name, transport.describe());
        }
        return this;
    }

    public String name() {
        return name;
    }

    public boolean isOpen() {
        return !closed.get();
    }

    public String closeReason() {
        return closeReason;
    }

    /**
     * Registers a listener run exactly once when the channel closes, immediately if it already has.
     */
    public void onClose(Consumer<WorkerChannel> listener) {
        closeListeners.add(listener);
        if (closed.get() && closeListeners.remove(listener)) {
            notifyListener(listener);
        }
    }

    /**
     * Sends a call and waits for its response.
     *
     * @throws WorkerTimeoutException when no response arrives in time; the channel stays open and the
     *         late response is discarded
     * @throws ChannelClosedException when the channel is or becomes closed before the response arrives
     * @throws FrameTooLargeException when the encoded call exceeds the frame limit; nothing is sent
     */
    public WorkerResponse submit(WorkerRequest request, Duration timeout) throws WorkerChannelException, InterruptedException {
        if (closed.get()) {
            throw new ChannelClosedException(name, closeReason);
        }
        long id = nextId.incrementAndGet();
        byte[] payload;
        try {
            payload = mapper.writeValueAsBytes(new CallEnvelope(id, request));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("cannot encode " + request.action().tag() + " call: " + e.getOriginalMessage(), e);
        }
        if (payload.length > codec.maxFrameBytes()) {
            throw new FrameTooLargeException(payload.length, codec.maxFrameBytes());
        }

        CompletableFuture<WorkerResponse> future = new CompletableFuture<>();
        pending.put(id, future);
        if (closed.get()) {
            pending.remove(id);
            throw new ChannelClosedException(name, closeReason);
        }
        try {
            synchronized (writeLock) {
                codec.write(transport.output(), payload);
            }
        } catch (IOException e) {
            pending.remove(id);
            closeWith("write failed: " + e.getMessage());
            throw new ChannelClosedException(name, closeReason, e);
        }

        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            abandon(id);
            throw new WorkerTimeoutException(request.action().tag() + " call " + id + " on channel " + name
                    + " got no response within " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            abandon(id);
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof WorkerChannelException channelFailure) {
                throw channelFailure;
            }
            throw new ChannelClosedException(name, String.valueOf(e.getCause()), e.getCause());
        }
    }

    public <T> T call(WorkerRequest request, Class<T> resultType, Duration timeout)
            throws WorkerChannelException, WorkerCallException, InterruptedException {
        return call(request, mapper.constructType(resultType), timeout);
    }

    public <T> T call(WorkerRequest request, TypeReference<T> resultType, Duration timeout)
            throws WorkerChannelException, WorkerCallException, InterruptedException {
        return call(request, mapper.getTypeFactory().constructType(resultType), timeout);
    }

    private <T> T call(WorkerRequest request, JavaType resultType, Duration timeout)
            throws WorkerChannelException, WorkerCallException, InterruptedException {
        WorkerResponse response = submit(request, timeout);
        if (response.failed()) {
            throw new WorkerCallException(response.error());
        }
        JsonNode result = response.result();
        if (result == null || result.isNull()) {
            return null;
        }
        try {
            return mapper.readerFor(resultType).readValue(result);
        } catch (IOException e) {
            throw new WorkerCallException(new WorkerError(WorkerError.MALFORMED_RESPONSE,
                    "cannot decode " + request.action().tag() + " result: " + e.getMessage()), e);
        }
    }

    @Override
    public void close() {
        closeWith("closed by owner");
    }

    int pendingCount() {
        return pending.size();
    }

    int abandonedCount() {
        return abandoned.size();
    }

    private void abandon(long id) {
        if (pending.remove(id) != null && !closed.get()) {
            abandoned.add(id);
        }
    }

    private void readLoop() {
        String reason = "worker ended the stream";
        try {
            while (!closed.get()) {
                byte[] frame = codec.read(transport.input());
                if (frame == null) {
                    break;
                }
                dispatch(frame);
            }
        } catch (IOException e) {
            reason = e.getClass().getSimpleName() + ": " + e.getMessage();
        } catch (RuntimeException e) {
            log.error("channel.reader.crashed channel={}", name, e);
            reason = "reader crashed: " + e.getMessage();
        }
        closeWith(reason);
    }

    private void dispatch(byte[] frame) {
        WorkerResponse response;
        try {
            response = mapper.readValue(frame, WorkerResponse.class);
        } catch (IOException e) {
            log.warn("channel.response.undecodable channel={} reason={}", name, e.getMessage());
            return;
        }
        CompletableFuture<WorkerResponse> future = pending.remove(response.id());
        if (future != null) {
            future.complete(response);
        } else if (abandoned.remove(response.id())) {
            log.debug("channel.response.late channel={} id={} discarded", name, response.id());
        } else {
            log.warn("channel.response.unmatched channel={} id={}", name, response.id());
        }
    }

    private void closeWith(String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closeReason = reason;
        log.info("channel.closed channel={} reason={} pending={}", name, reason, pending.size());

        Iterator<Map.Entry<Long, CompletableFuture<WorkerResponse>>> calls = pending.entrySet().iterator();
        while (calls.hasNext()) {
            Map.Entry<Long, CompletableFuture<WorkerResponse>> call = calls.next();
            calls.remove();
            call.getValue().completeExceptionally(new ChannelClosedException(name, reason));
        }
        abandoned.clear();

        try {
            transport.close();
        } catch (IOException e) {
            log.warn("channel.transport.close.failed channel={} reason={}", name, e.getMessage());
        }
        for (Consumer<WorkerChannel> listener : closeListeners) {
            if (closeListeners.remove(listener)) {
                notifyListener(listener);
            }
        }
    }

    private void notifyListener(Consumer<WorkerChannel> listener) {
        try {
            listener.accept(this);
        } catch (RuntimeException e) {
            log.warn("channel.close.listener.failed channel={} reason={}", name, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WorkerChannel[" + name + (closed.get() ? ", closed" : "") + "]";
    }
}
