package org.fleetfeast.node.spi;

/**
 * A long-running part of a node. The node starts processes in declaration order and stops them in
 * reverse.
 */
public interface IProcess {

    void start();

    void stop();
}
