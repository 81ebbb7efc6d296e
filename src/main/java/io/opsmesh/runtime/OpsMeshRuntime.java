package io.opsmesh.runtime;

import io.opsmesh.agent.AgentRegistry;
import io.opsmesh.agent.AgentStatus;
import io.opsmesh.bridge.BridgeHealth;
import io.opsmesh.bridge.CircuitBreaker;
import io.opsmesh.bridge.ContractRegistry;
import io.opsmesh.bridge.HttpValidatorClient;
import io.opsmesh.bridge.IntegrationBridge;
import io.opsmesh.bridge.RetryPolicy;
import io.opsmesh.bridge.ValidatorClient;
import io.opsmesh.bus.BusStats;
import io.opsmesh.bus.MessageBus;
import io.opsmesh.config.OpsMeshConfig;
import io.opsmesh.config.OpsMeshSettings;
import io.opsmesh.config.SettingsLoader;
import io.opsmesh.conflict.ConflictResolver;
import io.opsmesh.decision.ReasoningService;
import io.opsmesh.emergency.EmergencyManager;
import io.opsmesh.observability.AuditLogger;
import io.opsmesh.storage.CircuitStateStore;
import io.opsmesh.storage.Database;
import io.opsmesh.storage.DeadLetterStore;
import io.opsmesh.supervisor.CycleMetrics;
import io.opsmesh.supervisor.MetricsSource;
import io.opsmesh.supervisor.OperationalSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

public final class OpsMeshRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OpsMeshRuntime.class);
    public static final String BRIDGE_ID = "validator-bridge";

    private final OpsMeshConfig config;
    private final OpsMeshSettings settings;
    private final Database database;
    private final DeadLetterStore deadLetterStore;
    private final AuditLogger auditLogger;
    private final MessageBus bus;
    private final AgentRegistry agentRegistry;
    private final EmergencyManager emergencyManager;
    private final ConflictResolver conflictResolver;
    private final IntegrationBridge bridge;
    private final OperationalSupervisor supervisor;
    private volatile boolean closed;

    private OpsMeshRuntime(OpsMeshConfig config, Options options) {
        LongSupplier clock = System::currentTimeMillis;
        this.config = config;
        this.database = new Database(config);
        database.init();
        SettingsLoader.LoadOutcome loaded = new SettingsLoader(config).load();
        OpsMeshSettings base = loaded.settings();
        this.settings = options.validatorEndpoint() == null || options.validatorEndpoint().isBlank()
                ? base
                : withEndpoint(base, options.validatorEndpoint());
        this.auditLogger = new AuditLogger(config.auditFile(), settings.auditSigningSecret());
        SettingsLoader.audit(auditLogger, loaded);
        this.deadLetterStore = new DeadLetterStore(database);
        this.bus = new MessageBus(settings.busQueueCapacity(), settings.busWorkerThreads(),
                settings.busDeliveryAttempts(), clock);
        this.agentRegistry = new AgentRegistry(bus, settings.heartbeatIntervalMs(), settings.missedHeartbeats(),
                settings.evictionMultiplier());
        this.emergencyManager = new EmergencyManager(bus, settings.emergencyThresholds(), options.reasoning(),
                auditLogger, clock);
        this.conflictResolver = new ConflictResolver();
        CircuitBreaker breaker = new CircuitBreaker(
                BRIDGE_ID,
                settings.breakerFailureThreshold(),
                settings.breakerRecoveryTimeoutMs(),
                settings.breakerHalfOpenTrials(),
                clock,
                new CircuitStateStore(database),
                transition -> {
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("from", transition.from().label());
                    details.put("to", transition.to().label());
                    details.put("reason", transition.reason());
                    auditLogger.log(AuditLogger.AuditEvent.of("bridge.circuit.transition", BRIDGE_ID,
                            transition.channel(), transition.to().label(), details));
                }
        );
        this.bridge = new IntegrationBridge(
                BRIDGE_ID,
                resolveClient(options.validatorClient(), settings, clock),
                ContractRegistry.fromClasspath(),
                breaker,
                new RetryPolicy(settings.retryMaxAttempts(), settings.retryBaseDelayMs(), settings.retryMaxDelayMs(),
                        settings.retryJitterMs()),
                settings.validatorTimeoutMs(),
                deadLetterStore,
                bus,
                auditLogger,
                clock,
                null
        );
        this.supervisor = new OperationalSupervisor(
                bus,
                agentRegistry,
                emergencyManager,
                conflictResolver,
                bridge,
                options.metricsSource(),
                auditLogger,
                settings.tickPeriodMs(),
                settings.shutdownGraceMs(),
                clock
        );
        log.info("Runtime ready at {} (settings: {}, validator: {})", config.rootDir(), loaded.source(),
                bridge.validatorConfigured() ? "configured" : "none");
    }

    public static OpsMeshRuntime open(OpsMeshConfig config) {
        return open(config, Options.defaults());
    }

    public static OpsMeshRuntime open(OpsMeshConfig config, Options options) {
        return new OpsMeshRuntime(config, options == null ? Options.defaults() : options);
    }

    public void start() {
        if (closed) {
            throw new IllegalStateException("Runtime is closed");
        }
        supervisor.start();
    }

    public MetricsOutcome metrics() {
        return new MetricsOutcome(
                bus.stats(),
                agentRegistry.counts(),
                supervisor.metrics(),
                bridge.health(),
                emergencyManager.statistics()
        );
    }

    public OpsMeshConfig config() {
        return config;
    }

    public OpsMeshSettings settings() {
        return settings;
    }

    public MessageBus bus() {
        return bus;
    }

    public AgentRegistry agentRegistry() {
        return agentRegistry;
    }

    public EmergencyManager emergencyManager() {
        return emergencyManager;
    }

    public ConflictResolver conflictResolver() {
        return conflictResolver;
    }

    public IntegrationBridge bridge() {
        return bridge;
    }

    public OperationalSupervisor supervisor() {
        return supervisor;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public Database database() {
        return database;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        supervisor.close();
        bridge.close();
        bus.close();
        log.info("Runtime closed");
    }

    private static ValidatorClient resolveClient(ValidatorClient override, OpsMeshSettings settings, LongSupplier clock) {
        if (override != null) {
            return override;
        }
        if (!settings.validatorConfigured()) {
            return null;
        }
        return new HttpValidatorClient(settings.validatorEndpoint(), Duration.ofMillis(settings.validatorTimeoutMs()), clock);
    }

    private static OpsMeshSettings withEndpoint(OpsMeshSettings s, String endpoint) {
        return new OpsMeshSettings(s.tickPeriodMs(), s.shutdownGraceMs(), s.heartbeatIntervalMs(), s.missedHeartbeats(),
                s.evictionMultiplier(), s.busQueueCapacity(), s.busWorkerThreads(), s.busDeliveryAttempts(),
                s.breakerFailureThreshold(), s.breakerRecoveryTimeoutMs(), s.breakerHalfOpenTrials(),
                s.retryMaxAttempts(), s.retryBaseDelayMs(), s.retryMaxDelayMs(), s.retryJitterMs(),
                s.validatorTimeoutMs(), endpoint, s.auditSigningSecret(), s.emergencyThresholds());
    }

    /**
     * Collaborators that can be supplied by an embedding application. Any field may be null.
     *
     * @param validatorEndpoint overrides the endpoint from the settings file
     */
    public record Options(
            ValidatorClient validatorClient,
            ReasoningService reasoning,
            MetricsSource metricsSource,
            String validatorEndpoint
    ) {
        public static Options defaults() {
            return new Options(null, null, null, null);
        }
    }

    public record MetricsOutcome(
            BusStats bus,
            Map<AgentStatus, Integer> agents,
            CycleMetrics cycle,
            BridgeHealth bridge,
            EmergencyManager.Statistics emergencies
    ) {
    }
}
