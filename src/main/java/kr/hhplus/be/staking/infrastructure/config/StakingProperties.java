package kr.hhplus.be.staking.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "staking")
public class StakingProperties {

    private final Lock lock = new Lock();
    private final Notification notification = new Notification();

    @Getter
    @Setter
    public static class Lock {
        // 이벤트 락 대기 시간
        private Duration waitTimeout = Duration.ofSeconds(3);
    }

    @Getter
    @Setter
    public static class Notification {
        private final Kafka kafka = new Kafka();
    }

    @Getter
    @Setter
    public static class Kafka {
        private boolean enabled = false;
        private String topic = "event-staking-notifications";
    }
}
