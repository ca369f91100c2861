package kr.hhplus.be.staking.infrastructure.kafka;

import kr.hhplus.be.staking.infrastructure.config.StakingProperties;
import kr.hhplus.be.staking.infrastructure.kafka.message.StakingNotificationMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "staking.notification.kafka", name = "enabled", havingValue = "true")
public class StakingKafkaProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;

    public StakingKafkaProducer(KafkaTemplate<String, Object> kafkaTemplate, StakingProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = properties.getNotification().getKafka().getTopic();
    }

    /**
     * 스테이킹 알림을 Kafka로 발행 (이벤트 ID를 키로 사용해 이벤트별 순서 보장)
     */
    public void send(StakingNotificationMessage message) {
        String key = String.valueOf(message.eventId());

        kafkaTemplate.send(topic, key, message)
                .whenComplete((result, ex) -> {
                    if (ex == null) {
                        log.info("[Kafka] 알림 발행 성공 - topic: {}, key: {}, eventType: {}, partition: {}",
                                topic, key, message.eventType(), result.getRecordMetadata().partition());
                    } else {
                        log.error("[Kafka] 알림 발행 실패 - topic: {}, key: {}, eventType: {}",
                                topic, key, message.eventType(), ex);
                    }
                });
    }

    public String getTopic() {
        return topic;
    }
}
