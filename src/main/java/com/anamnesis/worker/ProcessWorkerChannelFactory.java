package com.anamnesis.worker;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Launches each worker as a child process running the given command plus the worker-kind argument.
 * The worker's stderr is inherited so its log lines land next to the coordinator's.
 */
public class ProcessWorkerChannelFactory implements WorkerChannelFactory {
    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerChannelFactory.class);

    private final List<String> command;
    private final FrameCodec codec;
    private final ObjectMapper mapper;
    private final ProcessStarter processStarter;
    private final AtomicInteger sequence = new AtomicInteger();

    public ProcessWorkerChannelFactory(List<String> command, int maxFrameBytes) {
        this(command, maxFrameBytes, new DefaultProcessStarter());
    }

    ProcessWorkerChannelFactory(List<String> command, int maxFrameBytes, ProcessStarter processStarter) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("worker command must not be empty");
        }
        this.command = List.copyOf(command);
        this.codec = new FrameCodec(maxFrameBytes);
        this.mapper = WorkerProtocol.mapper();
        this.processStarter = processStarter;
    }

    /**
     * The command that runs this application's own worker mode on the current JVM and classpath.
     */
    public static List<String> selfCommand(Path configPath) {
        List<String> command = new ArrayList<>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add("com.anamnesis.Main");
        command.add("--mode");
        command.add("worker");
        if (configPath != null) {
            command.add("--config");
            command.add(configPath.toString());
        }
        return command;
    }

    @Override
    public WorkerChannel open(WorkerKind kind) throws IOException {
        List<String> full = new ArrayList<>(command);
        full.add("--worker-kind");
        full.add(kind.label());
        Process process = processStarter.start(full);
        String name = kind.label() + "-" + sequence.incrementAndGet();
        log.info("worker.spawned channel={} pid={}", name, process.pid());
        return new WorkerChannel(name, new ProcessWorkerTransport(process), codec, mapper).start();
    }

    interface ProcessStarter {
        Process start(List<String> command) throws IOException;
    }

    private static final class DefaultProcessStarter implements ProcessStarter {
        @Override
        public Process start(List<String> command) throws IOException {
            return new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
        }
    }

    @Override
    public String toString() {
        return "ProcessWorkerChannelFactory{" +
                "command=" + command +
                ", processStarter=" + processStarter.getClass().getSimpleName() +
                '}';
    }
}
