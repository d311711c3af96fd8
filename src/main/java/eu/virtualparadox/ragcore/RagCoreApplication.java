package eu.virtualparadox.ragcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RagCoreApplication {

    public static void main(final String[] args) {
        SpringApplication.run(RagCoreApplication.class, args);
    }
}
