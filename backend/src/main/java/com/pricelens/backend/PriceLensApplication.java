package com.pricelens.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PriceLensApplication {
	public static void main(String[] args) {
		SpringApplication.run(PriceLensApplication.class, args);
	}
}
