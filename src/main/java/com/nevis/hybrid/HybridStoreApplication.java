package com.nevis.hybrid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HybridStoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(HybridStoreApplication.class, args);
	}
}
