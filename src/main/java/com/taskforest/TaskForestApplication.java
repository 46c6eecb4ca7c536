package com.taskforest;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class TaskForestApplication {

    public static void main(String[] args) {
        // Embedded engine only: no web server
        new SpringApplicationBuilder(TaskForestApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
