package com.homework.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.homework")
@ConfigurationPropertiesScan("com.homework")
@EnableScheduling
public class HomeworkApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(HomeworkApiApplication.class, args);
    }
}
