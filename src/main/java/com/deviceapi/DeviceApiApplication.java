package com.deviceapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point. Runs without a web server: the application only talks to devices as a client.
 */
@SpringBootApplication
public class DeviceApiApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(DeviceApiApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }
}
