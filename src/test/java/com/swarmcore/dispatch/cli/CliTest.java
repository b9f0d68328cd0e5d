package com.swarmcore.dispatch.cli;

import com.swarmcore.config.SwarmcoreProperties;
import com.swarmcore.core.engine.CoordinationManager;
import com.swarmcore.core.health.HealthCheckService;
import com.swarmcore.core.health.HealthStatus;
import com.swarmcore.core.resources.ResourceManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the swarmcore CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private CommandLine.IFactory createFactory(List<HealthStatus> health) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == HealthCommand.class) {
                    HealthCheckService mockHealth = mock(HealthCheckService.class);
                    when(mockHealth.checkAll()).thenReturn(health);
                    return (K) new HealthCommand(mockHealth);
                }
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(mock(CoordinationManager.class), new ResourceManager(),
                            new SwarmcoreProperties());
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(List.of(), args);
    }

    private CliResult execute(List<HealthStatus> health, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new SwarmcoreCommand(), createFactory(health));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static HealthStatus status(String component, HealthStatus.Status status, String detail) {
        return new HealthStatus(component, status, detail, Map.of());
    }

    // -- Help output ----------------------------------------------------------

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("health"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("swarmcore 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SWARMCORE v0.1.0"));
            assertTrue(result.output().contains("Usage:"));
        }

        @Test
        @DisplayName("run without a plan path is a usage error")
        void runRequiresPlan() {
            CliResult result = execute("run");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }

        @Test
        @DisplayName("unknown option is rejected")
        void unknownOption() {
            assertNotEquals(0, execute("--bogus").exitCode());
        }
    }

    // -- Health ---------------------------------------------------------------

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("all components UP -> exit 0")
        void allUp() {
            CliResult result = execute(List.of(
                    status("graph", HealthStatus.Status.UP, "3 task(s), acyclic"),
                    status("agents", HealthStatus.Status.UP, "2/2 agent(s) accepting work")), "health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("graph: 3 task(s), acyclic"));
            assertTrue(result.output().contains("all components operational"));
        }

        @Test
        @DisplayName("a degraded component -> exit 1")
        void degraded() {
            CliResult result = execute(List.of(
                    status("graph", HealthStatus.Status.UP, "acyclic"),
                    status("agents", HealthStatus.Status.DEGRADED, "No agents registered")), "health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("No agents registered"));
        }

        @Test
        @DisplayName("a component DOWN -> exit 1")
        void down() {
            CliResult result = execute(List.of(
                    status("pool", HealthStatus.Status.DOWN, "Pool is draining")), "health");

            assertEquals(1, result.exitCode());
        }
    }
}
