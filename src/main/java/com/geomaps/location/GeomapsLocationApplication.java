package com.geomaps.location;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GeomapsLocationApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeomapsLocationApplication.class, args);
    }
}
