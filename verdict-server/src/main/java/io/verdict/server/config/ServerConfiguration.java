package io.verdict.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.verdict.core.VerdictEnvironment;
import io.verdict.core.engine.ReviewEngine;
import io.verdict.core.merge.MergeCoordinator;
import io.verdict.core.policy.WorkflowPolicy;
import io.verdict.core.storage.SessionRepository;
import io.verdict.core.storage.SessionStore;
import io.verdict.serialization.SessionSerializer;
import io.verdict.serialization.WorkflowPolicyParser;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// CDI configuration for server-specific beans.
///
/// The environment itself comes from {@link VerdictEnvironmentProducer}. This class
/// produces:
/// - Utility beans (ObjectMapper, WorkflowPolicy)
/// - Delegating producers that expose environment components for direct injection
@ApplicationScoped
public class ServerConfiguration {

    private static final Logger LOG = Logger.getLogger(ServerConfiguration.class);

    @ConfigProperty(name = "verdict.policy.file")
    Optional<String> policyFile;

    // ========== Utility Beans ==========

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return SessionSerializer.createMapper();
    }

    /// Produces the workflow policy from `verdict.policy.file`, or the built-in defaults.
    ///
    /// @return the active policy, never null
    /// @throws io.verdict.core.exception.ValidationException if the file is unreadable or invalid
    @Produces
    @Singleton
    public WorkflowPolicy workflowPolicy() {
        if (policyFile.isPresent() && !policyFile.get().isBlank()) {
            WorkflowPolicy policy = WorkflowPolicyParser.parse(Path.of(policyFile.get().trim()));
            LOG.infov(
                    "Loaded workflow policy from {0}: item types {1}",
                    policyFile.get(),
                    policy.itemTypes().keySet());
            return policy;
        }
        LOG.info("Using default workflow policy");
        return WorkflowPolicy.defaults();
    }

    // ========== VerdictEnvironment Component Delegates ==========

    @Produces
    @Singleton
    public ReviewEngine reviewEngine(VerdictEnvironment env) {
        return env.getReviewEngine();
    }

    @Produces
    @Singleton
    public SessionStore sessionStore(VerdictEnvironment env) {
        return env.getSessionStore();
    }

    @Produces
    @Singleton
    public MergeCoordinator mergeCoordinator(VerdictEnvironment env) {
        return env.getMergeCoordinator();
    }

    @Produces
    @Singleton
    public SessionRepository sessionRepository(VerdictEnvironment env) {
        return env.getSessionRepository();
    }
}
