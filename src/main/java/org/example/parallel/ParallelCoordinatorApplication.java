package org.example.parallel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ParallelCoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ParallelCoordinatorApplication.class, args);
    }
}
