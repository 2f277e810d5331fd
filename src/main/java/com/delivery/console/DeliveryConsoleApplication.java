package com.delivery.console;

import com.delivery.console.repl.ReplRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeliveryConsoleApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(DeliveryConsoleApplication.class);
    private final ReplRunner replRunner;

    public DeliveryConsoleApplication(ReplRunner replRunner) {
        this.replRunner = replRunner;
    }

    public static void main(String[] args) {
        SpringApplication.run(DeliveryConsoleApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            replRunner.run();
        } catch (Exception e) {
            log.error("Startup failed: {}", e.getMessage());
            System.err.println("Startup failed: " + e.getMessage());
        }
    }
}
