package com.movesim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MovesimApplication {

    public static void main(String[] args) {
        SpringApplication.run(MovesimApplication.class, args);
    }
}
