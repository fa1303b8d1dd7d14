package com.p14n.kafkatopology;

import com.p14n.kafkatopology.client.BrokerClient;
import com.p14n.kafkatopology.client.kafka.KafkaBrokerClient;
import com.p14n.kafkatopology.resolver.ResolutionReport;
import com.p14n.kafkatopology.store.KafkaConfFile;

import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

public class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static String envVal(String name, String defaultValue) {
        var e = System.getenv(name);
        if (e != null && !e.isBlank()) {
            return e;
        }
        return defaultValue;
    }

    static Path configPath(String[] args) {
        if (args.length > 0) {
            return Path.of(args[0]);
        }
        return Path.of(envVal("KAFKA_CONF", KafkaConfFile.DEFAULT_FILENAME));
    }

    public static void main(String[] args) throws InterruptedException {
        BrokerClient client = new KafkaBrokerClient();
        if (VersionCommand.matches(args)) {
            System.out.println(new VersionCommand(client).output());
            return;
        }

        Path config = configPath(args);
        OpenTelemetry ot = Opentelemetry.fromEnvironment(envVal("KAFKA_SERVICE_NAME", "kafka-topology"));
        KafkaResourceModule module = KafkaResourceModule.forConfigFile(config, client, ot);

        ResolutionReport report;
        try {
            report = module.load();
        } catch (ModuleLoadException e) {
            logger.atError().setCause(e).addArgument(config).log("Unable to load {}");
            System.exit(1);
            return;
        }
        logFailures(report);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            module.unload();
            stopped.countDown();
        }, "kafka-topology-shutdown"));

        ConsoleCommands console = new ConsoleCommands(module, new VersionCommand(client), System.out);
        Thread consoleThread = new Thread(() -> {
            try {
                console.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                logger.atWarn().setCause(e).log("Console input failed, commands are no longer read");
            }
        }, "kafka-topology-console");
        consoleThread.setDaemon(true);
        consoleThread.start();

        stopped.await();
    }

    static void logFailures(ResolutionReport report) {
        for (ResolutionReport.Entry failure : report.failures()) {
            logger.atWarn()
                    .addArgument(failure.key().stage())
                    .addArgument(failure.key().id())
                    .addArgument(failure.kind())
                    .addArgument(failure.cause())
                    .log("{} {} failed ({}): {}");
        }
    }
}
