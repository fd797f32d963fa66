package com.goormthonuniv.sitecheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SiteCheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(SiteCheckApplication.class, args);
    }
}
