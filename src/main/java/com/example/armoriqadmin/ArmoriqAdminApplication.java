package com.example.armoriqadmin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ArmoriqAdminApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArmoriqAdminApplication.class, args);
    }
}
