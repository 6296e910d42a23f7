package com.warisan.agreement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WarisanApplication {

    public static void main(String[] args) {
        SpringApplication.run(WarisanApplication.class, args);
    }
}
