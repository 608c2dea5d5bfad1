package com.gdin.inspection.cognify;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CognifyApplication {

    public static void main(String[] args) {
        SpringApplication.run(CognifyApplication.class, args);
    }
}
