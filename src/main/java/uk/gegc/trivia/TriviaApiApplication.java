package uk.gegc.trivia;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TriviaApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriviaApiApplication.class, args);
    }
}
