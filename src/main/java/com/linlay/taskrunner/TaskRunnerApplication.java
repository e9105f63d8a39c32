package com.linlay.taskrunner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskRunnerApplication.class, args);
    }
}
