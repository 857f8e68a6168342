package com.dcabot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DcaBotApplication {

	public static void main(String[] args) {
		SpringApplication.run(DcaBotApplication.class, args);
	}
}
