package kr.hhplus.be.staking.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(StakingProperties.class)
public class StakingConfig {

    // 체크인/정산 시간 판정의 기준 시계
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
