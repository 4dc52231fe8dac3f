package com.example.plantreport;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest(properties = "report.storage-dir=${java.io.tmpdir}/plant-report-tests")
class PlantReportApplicationTests {

	/**
	 * Ensures the application context loads without throwing exceptions.
	 */
	@Test
	void contextLoads() {
	}

}
