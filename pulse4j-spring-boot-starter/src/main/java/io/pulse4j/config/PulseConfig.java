package io.pulse4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.JobHandler;
import io.pulse4j.Pulse;
import io.pulse4j.core.JobEventPublisher;
import io.pulse4j.core.JobHandlerRegistry;
import io.pulse4j.internal.mongo.MongoJobStore;
import io.pulse4j.internal.mongo.MongoPulse;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for Pulse components.
 */
@AutoConfiguration
@ConditionalOnClass({Pulse.class, MongoTemplate.class})
@EnableConfigurationProperties(PulseProperties.class)
@ConditionalOnProperty(prefix = "pulse", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PulseConfig {

    @Bean
    @ConditionalOnMissingBean
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, ObjectProvider<ObjectMapper> objectMapper) {
        return new MongoJobStore(mongoTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    protected PulseMongoIndexConfig pulseMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new PulseMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobEventPublisher jobEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringJobEventPublisher(applicationEventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public Pulse pulse(PulseProperties props, MongoJobStore jobStore, JobHandlerRegistry registry,
                       JobEventPublisher events) {
        return new MongoPulse(props, jobStore, registry, events);
    }

    @Bean
    @ConditionalOnMissingBean
    public PulseLifecycle pulseLifecycle(Pulse pulse) {
        return new PulseLifecycle(pulse);
    }

    @Bean
    @ConditionalOnProperty(prefix = "pulse", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton pulseIndexesInitializer(PulseMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
