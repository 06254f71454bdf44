package com.anamnesis.worker;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.TimeUnit;

/**
 * A worker running as a child process: its stdout carries responses, its stdin carries calls.
 */
public class ProcessWorkerTransport implements WorkerTransport {
    private static final long EXIT_GRACE_MILLIS = 2000;

    private final Process process;

    public ProcessWorkerTransport(Process process) {
        this.process = process;
    }

    @Override
    public InputStream input() {
        return process.getInputStream();
    }

    @Override
    public OutputStream output() {
        return process.getOutputStream();
    }

    @Override
    public String describe() {
        return "process pid=" + process.pid();
    }

    @Override
    public void close() throws IOException {
        try {
            // closing stdin is the worker's signal to finish and exit
            process.getOutputStream().close();
        } finally {
            try {
                if (!process.waitFor(EXIT_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
            }
            process.getInputStream().close();
        }
    }
}
