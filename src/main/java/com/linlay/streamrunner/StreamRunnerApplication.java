package com.linlay.streamrunner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StreamRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamRunnerApplication.class, args);
    }
}
