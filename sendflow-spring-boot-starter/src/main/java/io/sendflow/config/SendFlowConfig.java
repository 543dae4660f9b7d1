package io.sendflow.config;

import io.sendflow.ContactDirectory;
import io.sendflow.MessageSender;
import io.sendflow.SendFlow;
import io.sendflow.core.MessageLog;
import io.sendflow.core.ScheduleStore;
import io.sendflow.internal.DefaultSendFlow;
import io.sendflow.internal.InMemoryMessageLog;
import io.sendflow.internal.InMemoryScheduleStore;
import io.sendflow.internal.mongo.MongoMessageLog;
import io.sendflow.internal.mongo.MongoScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for SendFlow components.
 *
 * <p>The application provides a {@link MessageSender} and a {@link ContactDirectory}. Schedules and
 * the send history are kept in MongoDB when a {@link MongoTemplate} is available and in memory otherwise.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@ConditionalOnClass(SendFlow.class)
@EnableConfigurationProperties(SendFlowProperties.class)
@ConditionalOnProperty(prefix = "sendflow", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SendFlowConfig {
    private static final Logger log = LoggerFactory.getLogger(SendFlowConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock sendFlowClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleStore scheduleStore(ObjectProvider<MongoTemplate> mongoTemplateProvider) {
        MongoTemplate mongoTemplate = mongoTemplateProvider.getIfAvailable();
        if (mongoTemplate == null) {
            log.info("sendflow no MongoTemplate found, schedules are kept in memory");
            return new InMemoryScheduleStore();
        }
        return new MongoScheduleStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageLog messageLog(SendFlowProperties props, ObjectProvider<MongoTemplate> mongoTemplateProvider) {
        MongoTemplate mongoTemplate = mongoTemplateProvider.getIfAvailable();
        if (mongoTemplate == null) {
            return new InMemoryMessageLog(props.getMessageLogCapacity());
        }
        return new MongoMessageLog(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MongoTemplate.class)
    protected SendFlowMongoIndexConfig sendFlowMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new SendFlowMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({MessageSender.class, ContactDirectory.class})
    public SendFlow sendFlow(SendFlowProperties props,
                             ScheduleStore scheduleStore,
                             MessageLog messageLog,
                             ContactDirectory contactDirectory,
                             MessageSender messageSender,
                             Clock clock) {
        return new DefaultSendFlow(props, scheduleStore, messageLog, contactDirectory, messageSender, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(SendFlow.class)
    public SendFlowLifecycle sendFlowLifecycle(SendFlow sendFlow) {
        return new SendFlowLifecycle(sendFlow);
    }

    @Bean
    @ConditionalOnProperty(prefix = "sendflow", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton sendFlowIndexesInitializer(ObjectProvider<SendFlowMongoIndexConfig> indexConfig) {
        return () -> indexConfig.ifAvailable(SendFlowMongoIndexConfig::ensureIndexes);
    }
}
