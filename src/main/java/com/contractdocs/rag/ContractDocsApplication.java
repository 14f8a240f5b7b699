package com.contractdocs.rag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ContractDocsApplication {

	public static void main(String[] args) {
		SpringApplication.run(ContractDocsApplication.class, args);
	}
}
