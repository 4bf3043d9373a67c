package io.verdict.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.verdict.core.access.CallerContext;
import io.verdict.core.exception.StorageException;
import io.verdict.core.exception.ValidationException;
import io.verdict.core.storage.InMemorySessionRepository;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VerdictFactoryTest {

    @Nested
    class LoadConfigFromProperties {

        @Test
        void shouldUseDefaultsForMissingKeys() {
            VerdictConfig config = VerdictFactory.loadConfigFromProperties(new Properties());

            assertThat(config.getMergeTimeout()).isEqualTo(Duration.ofMinutes(5));
            assertThat(config.getMergeThreadPoolSize()).isEqualTo(4);
            assertThat(config.getMaxAppendAttempts()).isEqualTo(5);
            assertThat(config.getStorageType()).isEqualTo("memory");
        }

        @Test
        void shouldParseIsoAndSecondDurations() {
            Properties iso = new Properties();
            iso.setProperty("verdict.merge.timeout", "PT2M");
            Properties seconds = new Properties();
            seconds.setProperty("verdict.merge.timeout", "90");

            assertThat(VerdictFactory.loadConfigFromProperties(iso).getMergeTimeout())
                    .isEqualTo(Duration.ofMinutes(2));
            assertThat(VerdictFactory.loadConfigFromProperties(seconds).getMergeTimeout())
                    .isEqualTo(Duration.ofSeconds(90));
        }

        @Test
        void shouldReadPoolSizeAndAttempts() {
            Properties props = new Properties();
            props.setProperty("verdict.merge.pool-size", "2");
            props.setProperty("verdict.store.max-append-attempts", "9");
            props.setProperty("verdict.store.type", "jdbc");

            VerdictConfig config = VerdictFactory.loadConfigFromProperties(props);

            assertThat(config.getMergeThreadPoolSize()).isEqualTo(2);
            assertThat(config.getMaxAppendAttempts()).isEqualTo(9);
            assertThat(config.getStorageType()).isEqualTo("jdbc");
        }

        @Test
        void shouldRejectInvalidValues() {
            Properties props = new Properties();
            props.setProperty("verdict.merge.pool-size", "0");

            assertThatThrownBy(() -> VerdictFactory.loadConfigFromProperties(props))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Test
    void shouldWireDefaultEnvironment() {
        try (VerdictEnvironment env = VerdictFactory.createEnvironment()) {
            assertThat(env.getSessionRepository()).isInstanceOf(InMemorySessionRepository.class);
            assertThat(env.getWorkflowPolicy().itemTypes()).containsKey("pages");
            assertThat(env.getReviewEngine().createSession(CallerContext.operator("admin"), "ws-1").version())
                    .isZero();
        }
    }

    @Nested
    class MergeExecutorOwnership {

        @Test
        void shouldLeaveSuppliedExecutorRunningOnClose() throws Exception {
            // Given
            ExecutorService external = Executors.newSingleThreadExecutor();
            try {
                VerdictEnvironment env = VerdictFactory.builder().mergeExecutor(external).build();

                // When
                env.close();

                // Then
                assertThat(external.isShutdown()).isFalse();
                assertThat(external.submit(() -> "still running").get()).isEqualTo("still running");
            } finally {
                external.shutdownNow();
            }
        }
    }

    @Test
    void shouldRefuseWorkspaceOperationsWithoutWorkspaceSystem() {
        try (VerdictEnvironment env = VerdictFactory.createEnvironment()) {
            assertThatThrownBy(
                            () ->
                                    env.getReviewEngine()
                                            .openWorkspaceSession(CallerContext.operator("admin"), "main"))
                    .isInstanceOf(StorageException.class);
        }
    }
}
