package com.clausescan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClauseScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClauseScanApplication.class, args);
    }
}
