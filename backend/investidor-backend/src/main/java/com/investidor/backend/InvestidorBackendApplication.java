package com.investidor.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InvestidorBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvestidorBackendApplication.class, args);
    }
}
