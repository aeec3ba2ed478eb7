package com.flagship.payroll_ledger.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payroll_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes journal-posted notifications to Kafka as JSON.
 *
 * The event id is the record key, so all notifications for one business event land on
 * the same partition. The send is not awaited: the broker's acknowledgement is logged and
 * counted when it arrives. Only failures to build or hand over the record are thrown.
 */
@Slf4j
public class KafkaJournalNotifier implements JournalNotifier {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;
    private final LedgerMetrics ledgerMetrics;

    public KafkaJournalNotifier(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
                                String topic, LedgerMetrics ledgerMetrics) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
        this.ledgerMetrics = ledgerMetrics;
    }

    @Override
    public void journalPosted(JournalPostedNotification notification) {
        String key = notification.getEventId().toString();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new JournalNotificationException("Failed to serialize notification for " + key, e);
        }

        CompletableFuture<SendResult<String, String>> future;
        try {
            future = kafkaTemplate.send(topic, key, payload);
        } catch (RuntimeException e) {
            throw new JournalNotificationException("Failed to hand over notification for " + key, e);
        }

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                ledgerMetrics.recordNotificationFailure(notification.getEventKind());
                log.error("Failed to publish journal notification: journalId={}, key={}, error={}",
                        notification.getJournalId(), key, ex.getMessage(), ex);
                return;
            }
            ledgerMetrics.recordNotificationSent(notification.getEventKind());
            log.debug("Published journal notification: journalId={}, topic={}, partition={}, offset={}",
                    notification.getJournalId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
        });
    }
}
