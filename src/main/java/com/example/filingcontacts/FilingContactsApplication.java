package com.example.filingcontacts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FilingContactsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FilingContactsApplication.class, args);
    }
}
