package net.tickstore.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TickStoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(TickStoreApplication.class, args);
    }
}
