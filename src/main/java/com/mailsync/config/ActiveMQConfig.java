package com.mailsync.config;

import jakarta.jms.ConnectionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.activemq.ActiveMQConnectionFactory;
import org.apache.activemq.ActiveMQPrefetchPolicy;
import org.apache.activemq.broker.BrokerService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jms.annotation.EnableJms;
import org.springframework.jms.config.DefaultJmsListenerContainerFactory;
import org.springframework.jms.core.JmsTemplate;
import org.springframework.lang.NonNull;

/**
 * Sync job queue on an embedded, non-persistent ActiveMQ broker
 * - Listener concurrency is the sync worker pool size
 * - Prefetch 1 so a slow mailbox does not hold jobs other workers could take
 */
@Slf4j
@Configuration
@EnableJms
@RequiredArgsConstructor
public class ActiveMQConfig {

    private final SyncProperties properties;

    @Value("${spring.activemq.broker-url}")
    private String brokerUrl;

    @Bean(initMethod = "start", destroyMethod = "stop")
    public BrokerService brokerService() throws Exception {
        BrokerService broker = new BrokerService();
        broker.setBrokerName("mailsync-broker");
        broker.setPersistent(false);
        broker.setUseJmx(false);
        broker.setUseShutdownHook(false);
        broker.addConnector("vm://localhost");
        log.info("Sync queue broker configured (in-memory, destination: {})",
                properties.getQueue().getSyncDestination());
        return broker;
    }

    @Bean
    @DependsOn("brokerService")
    public @NonNull ConnectionFactory connectionFactory() {
        ActiveMQPrefetchPolicy prefetch = new ActiveMQPrefetchPolicy();
        prefetch.setQueuePrefetch(1);

        ActiveMQConnectionFactory factory = new ActiveMQConnectionFactory(brokerUrl);
        factory.setPrefetchPolicy(prefetch);
        return factory;
    }

    @Bean
    public JmsTemplate jmsTemplate(ConnectionFactory connectionFactory) {
        JmsTemplate template = new JmsTemplate(connectionFactory);
        template.setDeliveryPersistent(false);
        return template;
    }

    @Bean
    public DefaultJmsListenerContainerFactory jmsListenerContainerFactory(ConnectionFactory connectionFactory) {
        DefaultJmsListenerContainerFactory factory = new DefaultJmsListenerContainerFactory();
        factory.setConnectionFactory(connectionFactory);
        factory.setConcurrency(properties.getWorker().getConcurrency());
        // Failed cycles wait for the next notification instead of redelivery
        factory.setSessionTransacted(false);
        factory.setErrorHandler(t -> log.error("Sync listener error", t));
        return factory;
    }
}
