package com.voxagent.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.voxagent.gateway")
public class VoxAgentApp {

    public static void main(String[] args) {
        SpringApplication.run(VoxAgentApp.class, args);
    }
}
