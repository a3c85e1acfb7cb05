package com.acme.commandengine.processor.config;

import com.acme.commandengine.config.EngineConfig;
import com.acme.commandengine.config.MessagingConfig;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final EngineConfig engineConfig;
    private final MessagingConfig messagingConfig;

    @Property(name = "db.dialect")
    String dialect;

    @Property(name = "datasource.url")
    String datasourceUrl;

    @Property(name = "datasource.maximum-pool-size")
    int maxPoolSize;

    @Property(name = "kafka.bootstrap.servers")
    String kafkaBootstrapServers;

    public ConfigurationLogger(EngineConfig engineConfig, MessagingConfig messagingConfig) {
        this.engineConfig = engineConfig;
        this.messagingConfig = messagingConfig;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");

        LOG.info("━━━ Event Store ━━━");
        LOG.info("  Dialect:            {} (selects H2 or PostgreSQL statements)", dialect);
        LOG.info("  JDBC URL:           {}", datasourceUrl);
        LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", maxPoolSize);
        LOG.info("  Snapshot Threshold: {} (replayed events before a snapshot is written)",
                engineConfig.getSnapshotThreshold());

        LOG.info("━━━ Command Processing ━━━");
        LOG.info("  Concurrency:        {} (worker threads)", engineConfig.getCommandConcurrency());
        LOG.info("  Max Attempts:       {} (runs per command on conflicts)",
                engineConfig.getMaxAttempts());
        LOG.info("  Retry Backoff:      {} (multiplied by the attempt number)",
                engineConfig.getRetryBackoff());
        LOG.info("  Startup Recovery:   {} (republish unpublished events)",
                engineConfig.isRecoverUnpublishedOnStartup() ? "ENABLED" : "DISABLED");

        LOG.info("━━━ Messaging ━━━");
        MessagingConfig.TopicNaming topics = messagingConfig.getTopicNaming();
        LOG.info("  Event Topic:        {}", topics.getEventTopic());
        LOG.info("  Flow Topic:         {}", topics.getFlowTopic());
        LOG.info("  Per-Context Topics: {}", topics.isPerContext() ? "ENABLED" : "DISABLED");
        LOG.info("  Kafka Servers:      {}", kafkaBootstrapServers);

        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    }
}
