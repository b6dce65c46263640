package uk.gegc.linguapractice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LinguaPracticeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinguaPracticeApplication.class, args);
    }
}
