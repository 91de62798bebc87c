package com.rulesync.rulesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RuleSyncApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(RuleSyncApplication.class, args)));
    }
}
