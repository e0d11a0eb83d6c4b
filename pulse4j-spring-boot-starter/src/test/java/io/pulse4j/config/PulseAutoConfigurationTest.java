package io.pulse4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.Job;
import io.pulse4j.JobHandler;
import io.pulse4j.Pulse;
import io.pulse4j.core.JobEventPublisher;
import io.pulse4j.core.JobHandlerRegistry;
import io.pulse4j.internal.mongo.MongoPulse;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class PulseAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PulseConfig.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(JobHandler.class, DemoJobHandler::new)
            .withPropertyValues(
                    "pulse.enabled=true",
                    "pulse.worker-id=test-worker",
                    "pulse.process-every=500ms",
                    "pulse.default-lock-lifetime=5s",
                    "pulse.max-backoff-delay=30m"
            );

    @Test
    void shouldAutoConfigurePulseBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(Pulse.class);
            assertThat(context).hasSingleBean(PulseLifecycle.class);
            assertThat(context).hasSingleBean(PulseProperties.class);
            assertThat(context).hasSingleBean(PulseMongoIndexConfig.class);
            assertThat(context.getBean(JobEventPublisher.class)).isInstanceOf(SpringJobEventPublisher.class);
            assertThat(context.getBean(PulseLifecycle.class).isRunning()).isTrue();
        });
    }

    @Test
    void shouldBindPropertiesIntoScheduler() {
        contextRunner.run(context -> {
            MongoPulse pulse = (MongoPulse) context.getBean(Pulse.class);
            assertThat(pulse.workerId()).isEqualTo("test-worker");
            assertThat(pulse.lockLifetime()).isEqualTo(Duration.ofSeconds(5));
            assertThat(pulse.maxBackoffDelay()).isEqualTo(Duration.ofMinutes(30));
        });
    }

    @Test
    void shouldRegisterHandlerBeans() {
        contextRunner.run(context -> {
            JobHandlerRegistry registry = context.getBean(JobHandlerRegistry.class);
            assertThat(registry.find("demo")).isPresent();
            assertThat(registry.find("missing")).isEmpty();
        });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("pulse.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(Pulse.class));
    }

    @Test
    void shouldNotCreateIndexInitializerByDefault() {
        contextRunner.run(context ->
                assertThat(context).doesNotHaveBean("pulseIndexesInitializer"));
    }

    static class DemoJobHandler implements JobHandler<String> {
        @Override
        public String name() {
            return "demo";
        }

        @Override
        public Class<String> dataClass() {
            return String.class;
        }

        @Override
        public Object execute(Job<String> job) {
            return null;
        }
    }
}
