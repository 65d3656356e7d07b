package com.textidy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Textidy - LaTeX source formatting service.
 */
@SpringBootApplication
public class TextidyApplication {

	public static void main(String[] args) {
		SpringApplication.run(TextidyApplication.class, args);
	}

}
