package io.github.drompincen.clawtrigger.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.clawtrigger")
@EnableMongoRepositories(basePackages = "io.github.drompincen.clawtrigger.persistence.repository")
public class ClawTriggerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClawTriggerApplication.class, args);
    }
}
