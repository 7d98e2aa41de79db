package com.example.contractlens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContractLensApplication {
    public static void main(String[] args) {
        SpringApplication.run(ContractLensApplication.class, args);
    }
}
