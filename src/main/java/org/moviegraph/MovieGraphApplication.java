package org.moviegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MovieGraphApplication {
    public static void main(String[] args) {
        SpringApplication.run(MovieGraphApplication.class, args);
    }
}
