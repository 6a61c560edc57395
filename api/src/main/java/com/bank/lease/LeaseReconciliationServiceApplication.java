package com.bank.lease;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.bank.lease")
public class LeaseReconciliationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeaseReconciliationServiceApplication.class, args);
    }
}
