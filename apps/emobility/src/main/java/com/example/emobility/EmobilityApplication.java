package com.example.emobility;

import com.example.emobility.config.properties.AuthorizationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AuthorizationProperties.class)
public class EmobilityApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmobilityApplication.class, args);
    }

}
