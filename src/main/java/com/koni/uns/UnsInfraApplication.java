package com.koni.uns;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class UnsInfraApplication {

    public static void main(String[] args) {
        SpringApplication.run(UnsInfraApplication.class, args);
    }
}
