package com.yoursp.offload;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CryptoOffloadApplication {

    public static void main(String[] args) {
        SpringApplication.run(CryptoOffloadApplication.class, args);
    }
}
