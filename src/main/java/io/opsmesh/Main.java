package io.opsmesh;

import io.opsmesh.cli.OpsMeshCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) {
        CommandLine cli = new CommandLine(new OpsMeshCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((e, commandLine, parseResult) -> {
                    log.error("opsmesh {} failed", commandLine.getCommandName(), e);
                    commandLine.getErr().println("error: " + e.getMessage());
                    return 1;
                });
        System.exit(cli.execute(args));
    }
}
