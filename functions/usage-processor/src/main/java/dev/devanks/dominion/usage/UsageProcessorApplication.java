package dev.devanks.dominion.usage;

import com.google.cloud.spring.data.firestore.repository.config.EnableReactiveFirestoreRepositories;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@EnableReactiveFirestoreRepositories
public class UsageProcessorApplication {
    public static void main(String[] args) {
        SpringApplication.run(UsageProcessorApplication.class, args);
    }
}
