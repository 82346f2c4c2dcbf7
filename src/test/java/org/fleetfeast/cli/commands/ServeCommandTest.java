package org.fleetfeast.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.fleetfeast.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import picocli.CommandLine;

/**
 * Smoke tests for the serve command. Starting a full node is covered by the node tests.
 */
@Tag("unit")
public class ServeCommandTest {

    @Test
    void testHelpOutput() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        cmdLine.execute("serve", "--help");

        assertThat(out.toString() + err.toString()).contains("serve").contains("--port");
    }

    @Test
    void testMissingConfigFileFails() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));
        int exitCode = cmdLine.execute("--config", "does-not-exist.conf", "serve", "--port", "0");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("does-not-exist.conf");
    }

    @Test
    void testInvalidPortIsRejectedByParser() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));
        int exitCode = cmdLine.execute("serve", "--port", "eighty");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("eighty");
    }
}
