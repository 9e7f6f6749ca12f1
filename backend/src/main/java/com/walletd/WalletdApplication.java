package com.walletd;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WalletdApplication {

    public static void main(String[] args) {
        SpringApplication.run(WalletdApplication.class, args);
    }
}
