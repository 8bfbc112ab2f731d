package com.clapgrow.channels.whatsapp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WhatsAppWorkerApplication {
    public static void main(String[] args) {
        SpringApplication.run(WhatsAppWorkerApplication.class, args);
    }
}
