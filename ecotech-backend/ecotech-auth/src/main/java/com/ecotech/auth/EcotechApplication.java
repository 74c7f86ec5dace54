package com.ecotech.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.ecotech")
public class EcotechApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(EcotechApplication.class, args)));
    }
}
