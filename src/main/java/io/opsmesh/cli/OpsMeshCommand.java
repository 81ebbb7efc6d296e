package io.opsmesh.cli;

import io.opsmesh.bridge.DeadLetterEntry;
import io.opsmesh.bridge.DeliveryOutcome;
import io.opsmesh.config.OpsMeshConfig;
import io.opsmesh.observability.AuditLogger;
import io.opsmesh.observability.PrometheusFormatter;
import io.opsmesh.runtime.OpsMeshRuntime;
import io.opsmesh.util.Jsons;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "opsmesh",
        mixinStandardHelpOptions = true,
        description = "OpsMesh agent coordination runtime CLI",
        subcommands = {
                OpsMeshCommand.InitCommand.class,
                OpsMeshCommand.RunCommand.class,
                OpsMeshCommand.DeadLettersCommand.class,
                OpsMeshCommand.ReplayCommand.class,
                OpsMeshCommand.DiscardCommand.class,
                OpsMeshCommand.BridgeHealthCommand.class,
                OpsMeshCommand.MetricsCommand.class,
                OpsMeshCommand.SettingsCommand.class,
                OpsMeshCommand.AuditTailCommand.class,
                OpsMeshCommand.AuditVerifyCommand.class
        }
)
public final class OpsMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = OpsMeshConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | dead-letters | replay | discard | bridge-health | metrics | settings | audit-tail | audit-verify");
    }

    OpsMeshRuntime runtime() {
        return runtime(null);
    }

    OpsMeshRuntime runtime(String validatorUrl) {
        return OpsMeshRuntime.open(OpsMeshConfig.fromRoot(root),
                new OpsMeshRuntime.Options(null, null, null, validatorUrl));
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        OpsMeshCommand parent;

        @Override
        public Integer call() {
            try (OpsMeshRuntime runtime = parent.runtime()) {
                System.out.println("Initialized OpsMesh at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "run", description = "Run the coordination loop for a duration or until interrupted")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        OpsMeshCommand parent;

        @Option(names = {"--duration-ms"}, defaultValue = "0", description = "Stop after this many milliseconds; 0 runs until interrupted")
        long durationMs;

        @Option(names = {"--validator-url"}, description = "Validator endpoint, overrides the settings file")
        String validatorUrl;

        @Override
        public Integer call() throws Exception {
            OpsMeshRuntime runtime = parent.runtime(validatorUrl);
            CountDownLatch done = new CountDownLatch(1);
            Thread hook = new Thread(() -> {
                runtime.close();
                done.countDown();
            }, "opsmesh-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            runtime.start();
            if (durationMs > 0) {
                done.await(durationMs, TimeUnit.MILLISECONDS);
                Runtime.getRuntime().removeShutdownHook(hook);
                runtime.close();
                System.out.println(Jsons.toJson(runtime.supervisor().metrics()));
            } else {
                done.await();
            }
            return 0;
        }
    }

    @Command(name = "dead-letters", description = "List dead-lettered messages, oldest first")
    static final class DeadLettersCommand implements Callable<Integer> {
        @ParentCommand
        OpsMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            try (OpsMeshRuntime runtime = parent.runtime()) {
                List<Map<String, Object>> rows = new ArrayList<>();
                for (DeadLetterEntry entry : runtime.bridge().deadLetters(limit)) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("messageId", entry.messageId());
                    row.put("topic", entry.message().topic());
                    row.put("kind", entry.kind().name());
                    row.put("reason", entry.failureReason());
                    row.put("retryCount", entry.retryCount());
                    row.put("firstFailedAtMs", entry.firstFailedAtMs());
                    row.put("lastAttemptAtMs", entry.lastAttemptAtMs());
                    row.put("channel", entry.channel());
                    rows.add(row);
                }
                System.out.println(Jsons.toJson(rows));
            }
            return 0;
        }
    }

    @Command(name = "replay", description = "Re-deliver dead-lettered messages through the bridge")
    static final class ReplayCommand implements Callable<Integer> {
        @ParentCommand
        OpsMeshCommand parent;

        @ArgGroup(exclusive = true, multiplicity = "1")
        Target target;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max entries for --all")
        int limit;

        @Option(names = {"--validator-url"}, description = "Validator endpoint, overrides the settings file")
        String validatorUrl;

        static final class Target {
            @Option(names = {"--id"}, description = "Message id to replay")
            String id;

            @Option(names = {"--all"}, description = "Replay every entry, oldest first")
            boolean all;
        }

        @Override
        public Integer call() {
            try (OpsMeshRuntime runtime = parent.runtime(validatorUrl)) {
                if (!runtime.bridge().validatorConfigured()) {
                    System.err.println("No validator endpoint configured; use --validator-url or the settings file");
                    return 2;
                }
                if (target.all) {
                    List<DeliveryOutcome> outcomes = runtime.bridge().replayAll(limit);
                    System.out.println(Jsons.toJson(outcomes));
                    return 0;
                }
                DeliveryOutcome outcome = runtime.bridge().replay(target.id);
                System.out.println(Jsons.toJson(outcome));
                return outcome.status() == DeliveryOutcome.Status.NOT_FOUND ? 1 : 0;
            }
        }
    }

    @Command(name = "discard", description = "Drop a dead-lettered message")
    static final class DiscardCommand implements Callable<Integer> {
        @ParentCommand
        OpsMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Message id")
        String id;

        @Option(names = {"--reason"}, defaultValue = "operator discard", description = "Reason recorded in the audit log")
        String reason;

        @Override
        public Integer call() {
            try (OpsMeshRuntime runtime = parent.runtime()) {
                boolean removed = runtime.bridge().discard(id, reason);
                System.out.println(Jsons.toJson(Map.of("messageId", id, "discarded", removed)));
                return removed ? 0 : 1;
            }
        }
    }

    @Command(name = "bridge-health", description = "Show integration bridge health")
    static final class BridgeHealthCommand implements Callable<Integer> {
        @ParentCommand
        OpsMeshCommand parent;

        @Override
        public Integer call() {
            try (OpsMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.bridge().health()));
            }
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print metrics in Prometheus text format")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        OpsMeshCommand parent;

        @Override
        public Integer call() {
            try (OpsMeshRuntime runtime = parent.runtime()) {
                System.out.print(PrometheusFormatter.format(runtime.metrics()));
            }
            return 0;
        }
    }

    @Command(name = "settings", description = "Show effective runtime settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        OpsMeshCommand parent;

        @Override
        public Integer call() {
            try (OpsMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.settings().redacted()));
            }
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show the latest audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        OpsMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            try (OpsMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.auditLogger().tail(limit)));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        OpsMeshCommand parent;

        @Override
        public Integer call() {
            try (OpsMeshRuntime runtime = parent.runtime()) {
                AuditLogger.IntegrityOutcome outcome = runtime.auditLogger().verify();
                System.out.println(Jsons.toJson(outcome));
                return outcome.ok() ? 0 : 1;
            }
        }
    }
}
