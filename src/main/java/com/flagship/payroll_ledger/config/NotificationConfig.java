package com.flagship.payroll_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payroll_ledger.notification.JournalNotifier;
import com.flagship.payroll_ledger.notification.KafkaJournalNotifier;
import com.flagship.payroll_ledger.notification.LoggingJournalNotifier;
import com.flagship.payroll_ledger.observability.LedgerMetrics;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Chooses where journal-posted notifications go.
 *
 * ledger.notifications.kafka.enabled=true (default): JSON records on the configured topic.
 * Otherwise notifications are only logged.
 */
@Configuration
public class NotificationConfig {

    @Configuration
    @ConditionalOnProperty(name = "ledger.notifications.kafka.enabled", havingValue = "true", matchIfMissing = true)
    static class KafkaNotificationConfig {

        @Value("${ledger.notifications.kafka.topic:ledger.journal-posted}")
        private String topic;

        /**
         * Creates the notification topic if it doesn't exist.
         */
        @Bean
        public NewTopic journalPostedTopic() {
            return TopicBuilder.name(topic)
                    .partitions(3)
                    .replicas(1)
                    .build();
        }

        @Bean
        public JournalNotifier kafkaJournalNotifier(KafkaTemplate<String, String> kafkaTemplate,
                                                    ObjectMapper objectMapper,
                                                    LedgerMetrics ledgerMetrics) {
            return new KafkaJournalNotifier(kafkaTemplate, objectMapper, topic, ledgerMetrics);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "ledger.notifications.kafka.enabled", havingValue = "false")
    static class LoggingNotificationConfig {

        @Bean
        public JournalNotifier loggingJournalNotifier(LedgerMetrics ledgerMetrics) {
            return new LoggingJournalNotifier(ledgerMetrics);
        }
    }
}
