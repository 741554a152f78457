package com.cascade.flowqueue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowQueueApplication {
    public static void main(String[] args) {
        SpringApplication.run(FlowQueueApplication.class, args);
    }
}
