package com.codearena.runner;

import com.codearena.core.execution.Deadline;
import com.codearena.core.model.ExecutionRequest;
import com.codearena.core.model.FunctionMetadata;
import com.codearena.core.model.Language;
import com.codearena.core.model.TestCase;
import com.codearena.core.result.ResultNormalizer;
import com.codearena.sandbox.SandboxManager;
import com.codearena.sandbox.SandboxManager.SandboxRun;
import com.codearena.sandbox.SandboxProperties;
import com.codearena.sandbox.SandboxRequest;
import com.codearena.sandbox.StagingArea;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ContainerGoBackendTest {

    @TempDir
    Path stagingDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private SandboxManager sandboxManager;
    private ContainerGoBackend backend;

    private final ExecutionRequest request = new ExecutionRequest(
            "package main\n\nfunc Add(a int, b int) int { return a + b }\n",
            Language.COMPILED,
            List.of(new TestCase(List.of(IntNode.valueOf(1), IntNode.valueOf(2)), IntNode.valueOf(3)),
                    new TestCase(List.of(IntNode.valueOf(5), IntNode.valueOf(5)), IntNode.valueOf(10))),
            new FunctionMetadata("Add", List.of("int", "int"), "int"));

    @BeforeEach
    void setUp() {
        sandboxManager = mock(SandboxManager.class);
        backend = new ContainerGoBackend(sandboxManager, new StagingArea(stagingDir), new SandboxProperties(),
                new ResultNormalizer(mapper), mapper, null);
    }

    @Test
    void stagesRawCodeTestsAndMetadataForTheExecutor() throws Exception {
        Map<String, String> staged = new HashMap<>();
        when(sandboxManager.run(any(SandboxRequest.class), any(Deadline.class))).thenAnswer(invocation -> {
            SandboxRequest sandboxRequest = invocation.getArgument(0);
            for (var mount : sandboxRequest.mounts()) {
                staged.put(mount.containerPath(), Files.readString(mount.hostPath()));
            }
            assertTrue(sandboxRequest.name().startsWith("go-execution-"));
            assertEquals("go-runner", sandboxRequest.image());
            assertEquals(List.of("go-executor", "/code/user-code.go", "/code/test-cases.json",
                    "/code/metadata.json"), sandboxRequest.command());
            return new SandboxRun("sb-1", 0,
                    "[{\"passed\":true,\"expected\":3,\"actual\":3,\"error\":\"\"},"
                            + "{\"passed\":true,\"expected\":10,\"actual\":10,\"error\":\"\"}]",
                    false, 2_000);
        });

        var result = backend.execute(request);

        assertTrue(result.success());
        assertEquals(1_000, result.results().get(0).executionTimeMs());
        assertEquals(request.code(), staged.get("/code/user-code.go"));
        assertEquals("Add", mapper.readTree(staged.get("/code/metadata.json")).get("functionName").asText());
        assertEquals(2, mapper.readTree(staged.get("/code/test-cases.json")).size());
    }

    @Test
    void usesCompiledTimeout() {
        when(sandboxManager.run(any(SandboxRequest.class), any(Deadline.class)))
                .thenReturn(new SandboxRun("sb-1", -1, "", true, 35_000));

        var result = backend.execute(request);

        assertFalse(result.success());
        assertEquals("Go execution timeout - took longer than 35000ms", result.results().get(0).error());
        assertEquals(35_000, result.results().get(1).executionTimeMs());
    }

    @Test
    void classifiesExecutorBuildFailure() {
        when(sandboxManager.run(any(SandboxRequest.class), any(Deadline.class)))
                .thenReturn(new SandboxRun("sb-1", 1,
                        "[{\"passed\":false,\"expected\":null,\"actual\":null,"
                                + "\"error\":\"EXECUTION_ERROR: syntax error: unexpected }\"}]",
                        false, 500));

        var result = backend.execute(request);

        assertEquals(2, result.results().size());
        assertTrue(result.results().stream()
                .allMatch(r -> r.error().startsWith("Syntax error in your Go code.")));
    }
}
