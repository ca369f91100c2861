package kr.hhplus.be.staking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StakingApplication {

    public static void main(String[] args) {
        SpringApplication.run(StakingApplication.class, args);
    }
}
