package com.questrail.flysight.internal.transfer;

import com.questrail.flysight.api.TransferResult;
import com.questrail.flysight.internal.time.Cancellable;

import java.io.ByteArrayOutputStream;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * State of the single in-flight download.
 *
 * <p>Sequence numbers are 8-bit and wrap from 255 to 0.</p>
 */
final class TransferSession
{
    private final String filePath;
    private final String fileName;
    private final long expectedSize;
    private final Consumer<TransferResult> completion;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private int nextSequence;
    private Cancellable receiveTimeout;

    TransferSession(String filePath, long expectedSize, Consumer<TransferResult> completion)
    {
        this.filePath = Objects.requireNonNull(filePath, "filePath");
        this.fileName = leafName(filePath);
        this.expectedSize = Math.max(0L, expectedSize);
        this.completion = Objects.requireNonNull(completion, "completion");
    }

    static String leafName(String filePath)
    {
        int slash = filePath.lastIndexOf('/');
        return slash < 0 ? filePath : filePath.substring(slash + 1);
    }

    String filePath() {
        return filePath;
    }

    String fileName() {
        return fileName;
    }

    long expectedSize() {
        return expectedSize;
    }

    int nextSequence() {
        return nextSequence;
    }

    long receivedBytes() {
        return buffer.size();
    }

    boolean expects(int sequence) {
        return sequence == nextSequence;
    }

    void append(byte[] payload) {
        buffer.writeBytes(payload);
    }

    void advance() {
        nextSequence = (nextSequence + 1) & 0xFF;
    }

    byte[] data() {
        return buffer.toByteArray();
    }

    /**
     * {@code received / expected} clamped to {@code [0, 1]}; zero while the
     * expected size is unknown.
     */
    double progress() {
        if (expectedSize == 0L) {
            return 0.0;
        }
        return Math.min(1.0, (double) buffer.size() / (double) expectedSize);
    }

    void replaceReceiveTimeout(Cancellable timeout) {
        cancelReceiveTimeout();
        this.receiveTimeout = timeout;
    }

    void cancelReceiveTimeout() {
        if (receiveTimeout != null) {
            receiveTimeout.cancel();
            receiveTimeout = null;
        }
    }

    Consumer<TransferResult> completion() {
        return completion;
    }
}
