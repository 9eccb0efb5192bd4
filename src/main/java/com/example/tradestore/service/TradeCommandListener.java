package com.example.tradestore.service;

import com.example.tradestore.exception.TradeStoreException;
import com.example.tradestore.model.TradeCommand;
import com.example.tradestore.store.TradeDocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

import static com.example.tradestore.config.KafkaConfig.COMMANDS_TOPIC;

/**
 * Consumes trade commands from Kafka and applies them to the store.
 * Rejected or unreadable commands are logged and the offset is committed; nothing is retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeCommandListener {

    private final TradeDocumentStore tradeDocumentStore;

    @KafkaListener(topics = COMMANDS_TOPIC, groupId = "${spring.kafka.consumer.group-id}")
    public void handleCommand(
            @Payload(required = false) TradeCommand command,
            @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset) {

        // Deserialization errors arrive as a null payload
        if (command == null) {
            log.error("Received null trade command due to deserialization error - Topic: {}, Partition: {}, Offset: {}",
                    topic, partition, offset);
            return;
        }

        log.info("Received trade command from Kafka - Topic: {}, Partition: {}, Offset: {}, Operation: {}, Trade ID: {}",
                topic, partition, offset, command.operation(), command.id());

        try {
            dispatch(command);
            log.info("Applied {} command for trade {}", command.operation(), command.id());
        } catch (TradeStoreException e) {
            log.warn("Rejected {} command for trade {} [{}]: {}",
                    command.operation(), command.id(), e.getErrorCode(), e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Malformed {} command for trade {}: {}", command.operation(), command.id(), e.getMessage());
        } catch (Exception e) {
            log.error("Error applying {} command for trade {}: {}",
                    command.operation(), command.id(), e.getMessage(), e);
        }
    }

    void dispatch(TradeCommand command) {
        if (command.operation() == null) {
            throw new IllegalArgumentException("Command operation is required");
        }
        switch (command.operation()) {
            case SAVE_NEW -> tradeDocumentStore.saveNew(command.context(), command.id(), command.document());
            case SAVE_UPDATE -> tradeDocumentStore.saveFullReplace(
                    command.context(), command.id(), command.document(), command.expectedVersion());
            case SAVE_PARTIAL -> tradeDocumentStore.savePartial(
                    command.context(), command.id(), command.document(), command.expectedVersion());
            case DELETE -> tradeDocumentStore.deleteById(command.context(), command.id());
            default -> throw new IllegalArgumentException(
                    "Operation " + command.operation() + " is not accepted as a command");
        }
    }
}
