package com.questrail.amqp.transport.write;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Test-only stream recording each write call and each flush.
 *
 * <p>Optionally blocks inside the first write until {@link #releaseFirstWrite()}
 * is called, or fails every write with an {@link IOException}.</p>
 */
final class RecordingOutputStream extends OutputStream {

    private final List<byte[]> writes = new ArrayList<>();
    private final ByteArrayOutputStream all = new ByteArrayOutputStream();
    private int flushes;

    private final CountDownLatch firstWriteEntered = new CountDownLatch(1);
    private final CountDownLatch firstWriteGate;
    private volatile boolean failWrites;

    RecordingOutputStream(boolean gateFirstWrite) {
        this.firstWriteGate = new CountDownLatch(gateFirstWrite ? 1 : 0);
    }

    void failWrites() {
        failWrites = true;
    }

    void awaitFirstWrite() throws InterruptedException {
        firstWriteEntered.await();
    }

    void releaseFirstWrite() {
        firstWriteGate.countDown();
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[] { (byte) b }, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        firstWriteEntered.countDown();
        try {
            firstWriteGate.await();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException(e);
        }
        if (failWrites) {
            throw new IOException("broken pipe");
        }
        byte[] copy = new byte[len];
        System.arraycopy(b, off, copy, 0, len);
        synchronized (this) {
            writes.add(copy);
            all.write(copy, 0, len);
        }
    }

    @Override
    public synchronized void flush() {
        flushes++;
    }

    synchronized List<byte[]> writes() {
        return new ArrayList<>(writes);
    }

    synchronized byte[] bytes() {
        return all.toByteArray();
    }

    synchronized int flushes() {
        return flushes;
    }
}
