package org.fleetfeast.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.fleetfeast.cli.CommandLineInterface;
import org.fleetfeast.runtime.TestWorlds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

@Tag("unit")
public class DemandCommandTest {

    @TempDir
    Path tempDir;

    private Path configFile;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void writeConfig() throws IOException {
        configFile = tempDir.resolve("fleetfeast.conf");
        Files.writeString(configFile, "fleetfeast.world {\n" + TestWorlds.CITY + "\n}\n");
    }

    private int run(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void testCommandParses() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKeys("demand", "serve", "help");
    }

    @Test
    void testHelpOutput() {
        run("demand", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("--zone", "--day", "--base", "--csv");
    }

    @Test
    void testCsvForSingleZone() {
        int exitCode = run("-c", configFile.toString(), "demand", "--csv", "-z", "park");

        assertThat(exitCode).isZero();
        String[] lines = out.toString().trim().split("\\R");
        assertThat(lines).hasSize(25);
        assertThat(lines[0]).isEqualTo("zone,hour,demand");
        assertThat(lines[1]).isEqualTo("park,0,8.000");
        assertThat(lines[24]).isEqualTo("park,23,8.000");
    }

    @Test
    void testBarsForAllZones() {
        int exitCode = run("-c", configFile.toString(), "demand", "--base");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("downtown (max 4.0 orders/min)")
                .contains("university (max 3.0 orders/min)")
                .contains("park (max 8.0 orders/min)")
                .contains("  12:00 ")
                .contains("#".repeat(40));
    }

    @Test
    void testUnknownZoneFails() {
        int exitCode = run("-c", configFile.toString(), "demand", "-z", "airport");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("unknown zone 'airport'");
    }

    @Test
    void testMissingConfigFileFails() {
        int exitCode = run("-c", tempDir.resolve("missing.conf").toString(), "demand");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Configuration file not found");
    }
}
