package io.github.drompincen.repowatch.gateway;

import io.github.drompincen.repowatch.runtime.config.RepoWatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.repowatch")
@EnableMongoRepositories(basePackages = "io.github.drompincen.repowatch.persistence.repository")
@EnableConfigurationProperties(RepoWatchProperties.class)
@EnableScheduling
public class RepoWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepoWatchApplication.class, args);
    }
}
