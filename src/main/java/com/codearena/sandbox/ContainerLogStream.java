package com.codearena.sandbox;

import com.codearena.core.execution.FailureKind;
import com.codearena.core.execution.SandboxFailureException;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.model.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Pull-based view of a container's log stream.
 *
 * <p>docker-java pushes frames into this callback; the consumer pulls them with
 * {@link #readFully(Duration)}, which returns at end of stream and throws if
 * the stream failed or outlived the wait budget.
 * Stdout and stderr frames are interleaved in arrival order.
 */
public class ContainerLogStream extends ResultCallback.Adapter<Frame> {

    private static final Logger log = LoggerFactory.getLogger(ContainerLogStream.class);

    /** Identity sentinel marking the end of the stream. */
    private static final byte[] END_OF_STREAM = new byte[0];

    private final BlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
    private volatile Throwable failure;

    @Override
    public void onNext(Frame frame) {
        if (frame != null && frame.getPayload() != null) {
            chunks.add(frame.getPayload());
        }
    }

    @Override
    public void onError(Throwable throwable) {
        failure = throwable;
        chunks.add(END_OF_STREAM);
        super.onError(throwable);
    }

    @Override
    public void onComplete() {
        chunks.add(END_OF_STREAM);
        super.onComplete();
    }

    /**
     * Drains the stream until it ends.
     *
     * @throws SandboxFailureException if the stream terminated with an error or
     *                                 did not end within {@code timeout}
     */
    public byte[] readFully(Duration timeout) throws InterruptedException {
        var out = new ByteArrayOutputStream();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long left = deadline - System.nanoTime();
            if (left <= 0) {
                log.warn("Log stream did not end within {}ms after {} bytes", timeout.toMillis(), out.size());
                throw new SandboxFailureException(FailureKind.ENVIRONMENT_LIFECYCLE_FAILURE,
                        "Container output did not end within " + timeout.toMillis() + "ms");
            }
            byte[] chunk = chunks.poll(left, TimeUnit.NANOSECONDS);
            if (chunk == null) continue;
            if (chunk == END_OF_STREAM) break;
            out.writeBytes(chunk);
        }
        if (failure != null) {
            throw new SandboxFailureException(FailureKind.ENVIRONMENT_LIFECYCLE_FAILURE,
                    "Failed to read container output", failure);
        }
        return out.toByteArray();
    }
}
