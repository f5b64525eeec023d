package com.vestpod;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VestpodApplication {

    public static void main(String[] args) {
        SpringApplication.run(VestpodApplication.class, args);
    }
}
