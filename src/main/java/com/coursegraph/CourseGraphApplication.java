package com.coursegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CourseGraphApplication {
    public static void main(String[] args) {
        SpringApplication.run(CourseGraphApplication.class, args);
    }
}
