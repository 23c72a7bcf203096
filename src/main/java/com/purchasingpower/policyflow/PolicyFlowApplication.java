package com.purchasingpower.policyflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class PolicyFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolicyFlowApplication.class, args);
    }
}
