package com.dispatchplatform.broadcast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.dispatchplatform")
@ConfigurationPropertiesScan
public class BroadcastGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(BroadcastGatewayApplication.class, args);
    }
}
