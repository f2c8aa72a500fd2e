package com.secretnotes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SecretNotesApplication {

    public static void main(String[] args) {
        SpringApplication.run(SecretNotesApplication.class, args);
    }
}
