package net.jibri.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JibriTrackerApplication {
    public static void main(String[] args) {
        SpringApplication.run(JibriTrackerApplication.class, args);
    }
}
