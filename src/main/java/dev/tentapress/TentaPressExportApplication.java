package dev.tentapress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TentaPressExportApplication {

    public static void main(String[] args) {
        SpringApplication.run(TentaPressExportApplication.class, args);
    }
}
