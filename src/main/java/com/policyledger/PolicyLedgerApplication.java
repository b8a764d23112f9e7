package com.policyledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PolicyLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolicyLedgerApplication.class, args);
    }
}
