package com.drinkjoy.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DrinkjoyCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(DrinkjoyCatalogApplication.class, args);
    }
}
