package com.robobracket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoboBracketApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoboBracketApplication.class, args);
    }
}
