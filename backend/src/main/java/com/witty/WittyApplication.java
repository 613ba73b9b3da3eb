package com.witty;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Witty - natural-language to propositional logic formalization service.
 */
@SpringBootApplication
public class WittyApplication {

	public static void main(String[] args) {
		SpringApplication.run(WittyApplication.class, args);
	}

}
