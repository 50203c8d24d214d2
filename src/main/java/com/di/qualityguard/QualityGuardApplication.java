package com.di.qualityguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class QualityGuardApplication {

	public static void main(String[] args) {
		SpringApplication.run(QualityGuardApplication.class, args);
	}
}
