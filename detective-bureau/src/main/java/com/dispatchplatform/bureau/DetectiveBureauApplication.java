package com.dispatchplatform.bureau;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.dispatchplatform")
@ConfigurationPropertiesScan
public class DetectiveBureauApplication {

    public static void main(String[] args) {
        SpringApplication.run(DetectiveBureauApplication.class, args);
    }
}
