package com.patchpilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PatchPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatchPilotApplication.class, args);
    }
}
