package io.verdict.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.verdict.core.VerdictEnvironment;
import io.verdict.core.engine.ReviewEngine;
import io.verdict.core.exception.ValidationException;
import io.verdict.core.merge.MergeCoordinator;
import io.verdict.core.policy.WorkflowPolicy;
import io.verdict.core.storage.SessionRepository;
import io.verdict.core.storage.SessionStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ServerConfigurationTest {

    private ServerConfiguration config;
    private VerdictEnvironment env;

    @BeforeEach
    void setUp() {
        config = new ServerConfiguration();
        config.policyFile = Optional.empty();
        env = mock(VerdictEnvironment.class);
    }

    @Nested
    class UtilityBeans {

        @Test
        void shouldProduceObjectMapperWithReviewModel() {
            ObjectMapper mapper = config.objectMapper();

            assertThat(mapper.getRegisteredModuleIds())
                    .anySatisfy(id -> assertThat(id.toString()).contains("VerdictJacksonModule"));
        }

        @Test
        void shouldFallBackToDefaultPolicy() {
            WorkflowPolicy policy = config.workflowPolicy();

            assertThat(policy.itemTypes())
                    .containsOnlyKeys("pages", "quizzes", "assignments", "rubrics");
        }

        @Test
        void shouldLoadPolicyFromFile(@TempDir Path dir) throws Exception {
            // Given
            Path file =
                    Files.writeString(
                            dir.resolve("policy.json"),
                            "{\"glossary\":{\"required_passes\":[\"style\"],"
                                    + "\"required_approvals\":1}}");
            config.policyFile = Optional.of(file.toString());

            // When
            WorkflowPolicy policy = config.workflowPolicy();

            // Then
            assertThat(policy.itemTypes()).containsOnlyKeys("glossary");
        }

        @Test
        void shouldFailOnInvalidPolicyFile(@TempDir Path dir) throws Exception {
            Path file = Files.writeString(dir.resolve("policy.json"), "{\"glossary\":{}}");
            config.policyFile = Optional.of(file.toString());

            assertThatThrownBy(() -> config.workflowPolicy())
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    class EnvironmentDelegates {

        @Test
        void shouldExposeReviewEngine() {
            ReviewEngine engine = mock(ReviewEngine.class);
            when(env.getReviewEngine()).thenReturn(engine);

            assertThat(config.reviewEngine(env)).isSameAs(engine);
        }

        @Test
        void shouldExposeSessionStore() {
            SessionStore store = mock(SessionStore.class);
            when(env.getSessionStore()).thenReturn(store);

            assertThat(config.sessionStore(env)).isSameAs(store);
        }

        @Test
        void shouldExposeMergeCoordinator() {
            MergeCoordinator coordinator = mock(MergeCoordinator.class);
            when(env.getMergeCoordinator()).thenReturn(coordinator);

            assertThat(config.mergeCoordinator(env)).isSameAs(coordinator);
        }

        @Test
        void shouldExposeSessionRepository() {
            SessionRepository repository = mock(SessionRepository.class);
            when(env.getSessionRepository()).thenReturn(repository);

            assertThat(config.sessionRepository(env)).isSameAs(repository);
        }
    }
}
