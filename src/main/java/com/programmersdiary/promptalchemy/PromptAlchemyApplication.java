package com.programmersdiary.promptalchemy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PromptAlchemyApplication {

    public static void main(String[] args) {
        SpringApplication.run(PromptAlchemyApplication.class, args);
    }
}
