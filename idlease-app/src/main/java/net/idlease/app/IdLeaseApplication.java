package net.idlease.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IdLeaseApplication {

    public static void main(String[] args) {
        SpringApplication.run(IdLeaseApplication.class, args);
    }
}
