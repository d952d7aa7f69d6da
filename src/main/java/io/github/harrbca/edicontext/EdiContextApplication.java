package io.github.harrbca.edicontext;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdiContextApplication {

    public static void main(String[] args) {
        SpringApplication.run(EdiContextApplication.class, args);
    }
}
