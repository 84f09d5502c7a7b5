package com.txarchive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TxArchiveApplication {

    public static void main(String[] args) {
        SpringApplication.run(TxArchiveApplication.class, args);
    }
}
