package com.cyberx.vpnpool.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CredentialApiApplication {
    public static void main(String[] args) {
        SpringApplication.run(CredentialApiApplication.class, args);
    }
}
