package com.p14n.kafkatopology;

import com.p14n.kafkatopology.client.BrokerClient;

/**
 * {@code show version}: reports the Kafka client library in use.
 */
public class VersionCommand {

    public static final String PREFIX = "Kafka client version currently running against: ";

    private final BrokerClient client;

    public VersionCommand(BrokerClient client) {
        this.client = client;
    }

    public static boolean matches(String[] args) {
        return args.length == 2 && "show".equalsIgnoreCase(args[0]) && "version".equalsIgnoreCase(args[1]);
    }

    public String output() {
        return PREFIX + client.version();
    }
}
