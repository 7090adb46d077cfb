package com.webchat.chatbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.webchat")
public class WebchatBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebchatBackendApplication.class, args);
    }
}
