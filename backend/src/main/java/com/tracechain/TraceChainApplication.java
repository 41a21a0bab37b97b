package com.tracechain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TraceChainApplication {

    public static void main(String[] args) {
        SpringApplication.run(TraceChainApplication.class, args);
    }
}
