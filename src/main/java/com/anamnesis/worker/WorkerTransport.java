package com.anamnesis.worker;

import java.io.Closeable;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * The duplex byte streams to one worker. Closing the transport ends the worker's side too.
 */
public interface WorkerTransport extends Closeable {
    InputStream input();

    OutputStream output();

    String describe();
}
