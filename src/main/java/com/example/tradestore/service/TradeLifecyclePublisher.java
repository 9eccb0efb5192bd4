package com.example.tradestore.service;

import com.example.tradestore.model.OperationLogEntry;
import com.example.tradestore.model.TradeLifecycleEvent;
import com.example.tradestore.model.TradeType;
import com.example.tradestore.store.TradeLifecycleListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

import static com.example.tradestore.config.KafkaConfig.LIFECYCLE_TOPIC;

/**
 * Publishes a lifecycle event to Kafka for every committed store mutation.
 * Events are keyed by trade id; a purge has no trade id and is sent without a key.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeLifecyclePublisher implements TradeLifecycleListener {

    private final KafkaTemplate<String, TradeLifecycleEvent> kafkaTemplate;

    @Override
    @Retryable(retryFor = KafkaException.class, maxAttempts = 3, backoff = @Backoff(delay = 200))
    public void onMutation(OperationLogEntry entry, TradeType tradeType) {
        publish(TradeLifecycleEvent.from(entry, tradeType));
    }

    CompletableFuture<SendResult<String, TradeLifecycleEvent>> publish(TradeLifecycleEvent event) {
        String key = event.tradeId();

        log.info("Publishing {} event to Kafka topic: {} with key: {}", event.operation(), LIFECYCLE_TOPIC, key);

        CompletableFuture<SendResult<String, TradeLifecycleEvent>> future =
                kafkaTemplate.send(LIFECYCLE_TOPIC, key, event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish {} event with key: {} to topic: {}. Error: {}",
                        event.operation(), key, LIFECYCLE_TOPIC, ex.getMessage());
            } else {
                log.debug("Published {} event with key: {} to topic: {} at offset: {}",
                        event.operation(), key, LIFECYCLE_TOPIC, result.getRecordMetadata().offset());
            }
        });

        return future;
    }
}
