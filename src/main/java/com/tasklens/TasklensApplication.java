package com.tasklens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TasklensApplication {

    public static void main(String[] args) {
        SpringApplication.run(TasklensApplication.class, args);
    }
}
