package com.avari.signaling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SignalingBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalingBackendApplication.class, args);
    }
}
