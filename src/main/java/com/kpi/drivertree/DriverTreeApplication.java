package com.kpi.drivertree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DriverTreeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriverTreeApplication.class, args);
    }
}
