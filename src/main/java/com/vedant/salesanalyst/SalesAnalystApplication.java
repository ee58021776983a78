package com.vedant.salesanalyst;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SalesAnalystApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesAnalystApplication.class, args);
    }
}
