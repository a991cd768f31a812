package com.conciliator.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StatementEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(StatementEngineApplication.class, args);
	}

}
