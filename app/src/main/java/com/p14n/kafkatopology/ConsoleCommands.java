package com.p14n.kafkatopology;

import com.p14n.kafkatopology.resolver.ResolutionReport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Operator commands read one per line while the module is running:
 * {@code reload} re-reads the configuration and resolves the topology again,
 * {@code show version} prints the client library version.
 */
public class ConsoleCommands {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleCommands.class);

    static final String RELOAD = "reload";
    static final String SHOW_VERSION = "show version";

    private final KafkaResourceModule module;
    private final VersionCommand version;
    private final PrintStream out;

    public ConsoleCommands(KafkaResourceModule module, VersionCommand version, PrintStream out) {
        this.module = module;
        this.version = version;
        this.out = out;
    }

    /**
     * Executes commands until the input ends.
     */
    public void run(BufferedReader in) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            execute(line);
        }
        logger.atDebug().log("Console input closed");
    }

    void execute(String line) {
        String command = line.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        switch (command) {
            case "":
                break;
            case RELOAD:
                reload();
                break;
            case SHOW_VERSION:
                out.println(version.output());
                break;
            default:
                out.println("Unknown command '" + line.trim() + "'");
        }
    }

    private void reload() {
        try {
            ResolutionReport report = module.reload();
            App.logFailures(report);
            out.println("Reloaded: " + report.successes().size() + " resolved, "
                    + report.failures().size() + " failed");
        } catch (IOException e) {
            logger.atError().setCause(e).log("Reload failed, keeping the current topology");
            out.println("Reload failed: " + e.getMessage());
        } catch (IllegalStateException e) {
            out.println("Reload failed: " + e.getMessage());
        }
    }
}
