package com.gdin.inspection.modular;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModularDecompositionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModularDecompositionApplication.class, args);
    }
}
