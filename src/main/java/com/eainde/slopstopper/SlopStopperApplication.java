package com.eainde.slopstopper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SlopStopperApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SlopStopperApplication.class, args)));
    }
}
