package com.cgi.schemasense;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SchemaSenseApplication {

	public static void main(String[] args) {
		SpringApplication.run(SchemaSenseApplication.class, args);
	}

}
