package com.example.plantreport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point for the plant report service.
 * This class lives in the bootstrap layer and should only be used to wire the
 * application context and hand over control to Spring.
 */
@SpringBootApplication
public class PlantReportApplication {

	/**
	 * Boots the Spring container and exposes the report download endpoint.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(PlantReportApplication.class, args);
	}

}
