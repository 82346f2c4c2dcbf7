package org.fleetfeast.cli.commands;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.fleetfeast.cli.CommandLineInterface;
import org.fleetfeast.cli.config.ConfigLoader;
import org.fleetfeast.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs the simulation server until the JVM is interrupted.
 */
@Command(
    name = "serve",
    description = "Run the simulation, agent bridge and HTTP server until interrupted"
)
public class ServeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    @Option(
        names = {"-p", "--port"},
        description = "HTTP port (overrides fleetfeast.http.port)"
    )
    private Integer port;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final Node node;
        try {
            Config config = parent.getConfig().getConfig(ConfigLoader.ROOT);
            if (port != null) {
                config = config.withValue("http.port", ConfigValueFactory.fromAnyRef(port));
            }
            node = new Node(config);
            node.start();
        } catch (IllegalArgumentException e) {
            log.error("Cannot start: {}", e.getMessage());
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }

        final CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            node.stop();
            stopped.countDown();
        }, "shutdown-hook"));

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            node.stop();
        }
        return 0;
    }
}
