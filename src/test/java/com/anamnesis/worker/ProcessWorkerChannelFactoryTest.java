package com.anamnesis.worker;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessWorkerChannelFactoryTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @Test
    void shouldAppendWorkerKindAndTalkOverProcessStreams() throws Exception {
        List<List<String>> launched = new ArrayList<>();
        List<FakeProcess> processes = new ArrayList<>();
        ProcessWorkerChannelFactory factory = new ProcessWorkerChannelFactory(List.of("anamnesis-worker", "--quiet"),
                FrameCodec.DEFAULT_MAX_FRAME_BYTES, command -> {
                    launched.add(command);
                    FakeProcess process = FakeProcess.serving(request -> new Pong("from-process", WorkerKind.RDF), true);
                    processes.add(process);
                    return process;
                });

        WorkerChannel channel = factory.open(WorkerKind.RDF);

        assertEquals(List.of(List.of("anamnesis-worker", "--quiet", "--worker-kind", "rdf")), launched);
        assertEquals("rdf-1", channel.name());
        assertEquals("from-process", channel.call(new WorkerRequest.Ping("p"), Pong.class, WAIT).token());

        channel.close();
        assertFalse(channel.isOpen());
        assertFalse(processes.get(0).destroyForciblyCalled);
    }

    @Test
    void shouldKillWorkerThatIgnoresClosedInput() throws Exception {
        FakeProcess stubborn = FakeProcess.serving(request -> new Pong("x", WorkerKind.PARSER), false);
        ProcessWorkerTransport transport = new ProcessWorkerTransport(stubborn);

        transport.close();

        assertTrue(stubborn.destroyForciblyCalled);
    }

    @Test
    void shouldCloseChannelWhenProcessExitsImmediately() throws Exception {
        ProcessWorkerChannelFactory factory = new ProcessWorkerChannelFactory(List.of("missing-binary"),
                FrameCodec.DEFAULT_MAX_FRAME_BYTES, command -> FakeProcess.exited());

        WorkerChannel channel = factory.open(WorkerKind.PARSER);

        Eventually.await("channel close", WAIT, () -> !channel.isOpen());
        assertThrows(ChannelClosedException.class, () -> channel.call(new WorkerRequest.Ping("p"), Pong.class, WAIT));
    }

    @Test
    void shouldRejectEmptyCommand() {
        assertThrows(IllegalArgumentException.class, () -> new ProcessWorkerChannelFactory(List.of(), 1024));
    }

    @Test
    void shouldBuildSelfCommandForWorkerMode() {
        List<String> command = ProcessWorkerChannelFactory.selfCommand(Path.of("/etc/anamnesis.yml"));

        assertTrue(command.get(0).endsWith("java"));
        assertEquals(List.of("com.anamnesis.Main", "--mode", "worker", "--config", "/etc/anamnesis.yml"),
                command.subList(3, command.size()));
        assertFalse(ProcessWorkerChannelFactory.selfCommand(null).contains("--config"));
    }

    private static final class FakeProcess extends Process {
        private final InputStream stdout;
        private final OutputStream stdin;
        private final Thread server;
        private final boolean exitsWhenInputCloses;
        private boolean destroyForciblyCalled;

        private FakeProcess(InputStream stdout, OutputStream stdin, Thread server, boolean exitsWhenInputCloses) {
            this.stdout = stdout;
            this.stdin = stdin;
            this.server = server;
            this.exitsWhenInputCloses = exitsWhenInputCloses;
        }

        static FakeProcess serving(WorkerHandler handler, boolean exitsWhenInputCloses) {
            MemoryPipe toWorker = new MemoryPipe();
            MemoryPipe fromWorker = new MemoryPipe();
            WorkerServer workerServer = new WorkerServer(handler, toWorker.input(), fromWorker.output(),
                    FrameCodec.DEFAULT_MAX_FRAME_BYTES, 2);
            Thread thread = new Thread(() -> {
                try {
                    workerServer.serve();
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                } finally {
                    fromWorker.close();
                }
            }, "fake-worker-process");
            thread.setDaemon(true);
            thread.start();
            return new FakeProcess(fromWorker.input(), toWorker.output(), thread, exitsWhenInputCloses);
        }

        static FakeProcess exited() {
            return new FakeProcess(new ByteArrayInputStream(new byte[0]), OutputStream.nullOutputStream(), null, true);
        }

        @Override
        public OutputStream getOutputStream() {
            return stdin;
        }

        @Override
        public InputStream getInputStream() {
            return stdout;
        }

        @Override
        public InputStream getErrorStream() {
            return InputStream.nullInputStream();
        }

        @Override
        public int waitFor() throws InterruptedException {
            if (server != null) {
                server.join();
            }
            return 0;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            if (!exitsWhenInputCloses) {
                return false;
            }
            if (server != null) {
                server.join(unit.toMillis(timeout));
                return !server.isAlive();
            }
            return true;
        }

        @Override
        public int exitValue() {
            return 0;
        }

        @Override
        public void destroy() {
        }

        @Override
        public Process destroyForcibly() {
            destroyForciblyCalled = true;
            return this;
        }

        @Override
        public long pid() {
            return 4242;
        }
    }
}
