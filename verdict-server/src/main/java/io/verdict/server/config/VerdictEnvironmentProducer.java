package io.verdict.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.verdict.core.VerdictConfig;
import io.verdict.core.VerdictEnvironment;
import io.verdict.core.VerdictFactory;
import io.verdict.core.access.AccessPolicy;
import io.verdict.core.access.RoleBasedAccessPolicy;
import io.verdict.core.listener.ReviewListener;
import io.verdict.core.policy.WorkflowPolicy;
import io.verdict.core.workspace.RemoteSyncChecker;
import io.verdict.core.workspace.WorkspaceManager;
import io.verdict.server.persistence.JdbcSessionRepository;
import io.verdict.server.review.LoggingReviewListener;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.util.Properties;
import javax.sql.DataSource;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// CDI producer for the review engine environment.
///
/// Wires the core components through {@link VerdictFactory}: session store, merge
/// coordinator and engine facade. Collaborators are taken from CDI when an application
/// provides them.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `verdict.merge.timeout` | Duration | `PT5M` | Bound on the external merge call |
/// | `verdict.merge.pool-size` | Integer | `4` | Merge worker threads |
/// | `verdict.store.max-append-attempts` | Integer | `5` | Optimistic write retries |
/// | `verdict.access.role-based` | Boolean | `true` | Enforce the agent role table |
/// | `quarkus.datasource.active` | Boolean | `true` | PostgreSQL store when true, else in-memory |
///
/// @implNote Application-scoped singleton. Thread-safe after initialization.
///
/// @see VerdictEnvironment
/// @see VerdictFactory
@ApplicationScoped
public class VerdictEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(VerdictEnvironmentProducer.class);

    static final String ROLE_BASED_KEY = "verdict.access.role-based";

    private VerdictEnvironment verdictEnvironment;

    @Inject Config config;

    @Inject Instance<DataSource> dataSourceInstance;

    @Inject ObjectMapper objectMapper;

    @Inject WorkflowPolicy workflowPolicy;

    @Inject Instance<WorkspaceManager> workspaceManagerInstance;

    @Inject Instance<RemoteSyncChecker> syncCheckerInstance;

    @Inject Instance<AccessPolicy> accessPolicyInstance;

    @Inject Instance<ReviewListener> reviewListeners;

    /// Produces the review environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    @Produces
    @ApplicationScoped
    public VerdictEnvironment verdictEnvironment() {
        VerdictConfig verdictConfig = VerdictFactory.loadConfigFromProperties(extractProperties());

        VerdictFactory.Builder factoryBuilder =
                VerdictFactory.builder()
                        .config(verdictConfig)
                        .policy(workflowPolicy)
                        .listener(new LoggingReviewListener());

        boolean dsActive =
                config.getOptionalValue("quarkus.datasource.active", Boolean.class).orElse(true);

        if (dsActive && dataSourceInstance.isResolvable()) {
            factoryBuilder.repository(
                    new JdbcSessionRepository(dataSourceInstance.get(), objectMapper));
            verdictConfig.setStorageType("jdbc");
            LOG.info("Using JDBC persistence (PostgreSQL)");
        } else {
            LOG.info("Using in-memory persistence");
        }

        if (workspaceManagerInstance.isResolvable()) {
            factoryBuilder.workspaceManager(workspaceManagerInstance.get());
            LOG.info("Using CDI-provided WorkspaceManager");
        } else {
            LOG.warn("No WorkspaceManager bean; merges will fail until one is provided");
        }

        if (syncCheckerInstance.isResolvable()) {
            factoryBuilder.syncChecker(syncCheckerInstance.get());
        }

        if (accessPolicyInstance.isResolvable()) {
            factoryBuilder.accessPolicy(accessPolicyInstance.get());
            LOG.info("Using CDI-provided AccessPolicy");
        } else if (config.getOptionalValue(ROLE_BASED_KEY, Boolean.class).orElse(true)) {
            factoryBuilder.accessPolicy(new RoleBasedAccessPolicy());
            LOG.info("Using role-based access policy");
        } else {
            LOG.warn("Access control disabled; every caller may perform every operation");
        }

        for (ReviewListener listener : reviewListeners) {
            factoryBuilder.listener(listener);
            LOG.infov("Registered review listener: {0}", listener.getClass().getName());
        }

        verdictEnvironment = factoryBuilder.build();
        LOG.info("Configured VerdictEnvironment via VerdictFactory");
        return verdictEnvironment;
    }

    /// Copies `verdict.*` properties from Quarkus config.
    private Properties extractProperties() {
        Properties properties = new Properties();
        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith("verdict.")) {
                config.getOptionalValue(propertyName, String.class)
                        .ifPresent(value -> properties.setProperty(propertyName, value));
            }
        }
        return properties;
    }

    /// Closes the environment to release the merge thread pool.
    @PreDestroy
    public void cleanup() {
        if (verdictEnvironment != null) {
            verdictEnvironment.close();
            LOG.info("VerdictEnvironment closed");
        }
    }
}
