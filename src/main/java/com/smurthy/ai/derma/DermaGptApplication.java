package com.smurthy.ai.derma;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DermaGptApplication {

	public static void main(String[] args) {
		SpringApplication.run(DermaGptApplication.class, args);
	}

}
