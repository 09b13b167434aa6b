package net.scanorama.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScanoramaApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScanoramaApplication.class, args);
    }
}
