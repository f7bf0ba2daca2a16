package com.codearena.sandbox;

import com.codearena.core.execution.FailureKind;
import com.codearena.core.execution.SandboxFailureException;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.StreamType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ContainerLogStreamTest {

    private static Frame frame(StreamType type, String text) {
        return new Frame(type, text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void concatenatesFramesInArrivalOrder() throws Exception {
        var stream = new ContainerLogStream();
        stream.onNext(frame(StreamType.STDOUT, "a"));
        stream.onNext(frame(StreamType.STDERR, "b"));
        stream.onNext(frame(StreamType.STDOUT, "c"));
        stream.onComplete();

        assertEquals("abc", new String(stream.readFully(Duration.ofSeconds(1)), StandardCharsets.UTF_8));
    }

    @Test
    void framesPushedFromAnotherThreadAreReceived() throws Exception {
        var stream = new ContainerLogStream();
        var producer = new Thread(() -> {
            stream.onNext(frame(StreamType.STDOUT, "late"));
            stream.onComplete();
        });
        producer.start();

        byte[] bytes = stream.readFully(Duration.ofSeconds(5));
        producer.join();

        assertEquals("late", new String(bytes, StandardCharsets.UTF_8));
    }

    @Test
    void errorTerminatesWithException() {
        var stream = new ContainerLogStream();
        stream.onNext(frame(StreamType.STDOUT, "partial"));
        stream.onError(new RuntimeException("broken pipe"));

        var ex = assertThrows(SandboxFailureException.class, () -> stream.readFully(Duration.ofSeconds(1)));
        assertEquals("broken pipe", ex.getCause().getMessage());
    }

    @Test
    void streamThatNeverEndsIsLifecycleFailure() {
        var stream = new ContainerLogStream();
        stream.onNext(frame(StreamType.STDOUT, "so far"));

        var ex = assertThrows(SandboxFailureException.class, () -> stream.readFully(Duration.ofMillis(50)));
        assertEquals(FailureKind.ENVIRONMENT_LIFECYCLE_FAILURE, ex.kind());
        assertTrue(ex.getMessage().contains("50ms"));
    }

    @Test
    void emptyPayloadIsNotEndOfStream() throws Exception {
        var stream = new ContainerLogStream();
        stream.onNext(frame(StreamType.STDOUT, ""));
        stream.onNext(frame(StreamType.STDOUT, "x"));
        stream.onComplete();

        assertEquals("x", new String(stream.readFully(Duration.ofSeconds(1)), StandardCharsets.UTF_8));
    }
}
