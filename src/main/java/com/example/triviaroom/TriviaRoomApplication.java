package com.example.triviaroom;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TriviaRoomApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriviaRoomApplication.class, args);
    }
}
