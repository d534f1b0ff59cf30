package com.openforge.actionmind;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ActionMindApplication {

    public static void main(String[] args) {
        SpringApplication.run(ActionMindApplication.class, args);
    }
}
