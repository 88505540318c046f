package com.example.docassembly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocAssemblyApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocAssemblyApplication.class, args);
    }
}
