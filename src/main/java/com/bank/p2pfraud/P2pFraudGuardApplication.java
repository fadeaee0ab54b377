package com.bank.p2pfraud;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class P2pFraudGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(P2pFraudGuardApplication.class, args);
    }
}
