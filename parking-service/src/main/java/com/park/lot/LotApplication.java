package com.park.lot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LotApplication {
    public static void main(String[] args) { SpringApplication.run(LotApplication.class, args); }
}
