package io.bibliotek;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BibliotekApplication {

    public static void main(String[] args) {
        SpringApplication.run(BibliotekApplication.class, args);
    }
}
