package io.github.drompincen.collabsync.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.collabsync")
@EnableMongoRepositories(basePackages = "io.github.drompincen.collabsync.persistence.repository")
public class CollabSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollabSyncApplication.class, args);
    }
}
