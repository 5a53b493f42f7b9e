package com.example.vexreport;

import com.example.vexreport.infrastructure.config.ReportProperties;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Application entry point for the batch converter.
 * This class only wires the application context and hands over control to Spring; the exit code comes from
 * the command-line runner.
 */
@SpringBootApplication
@EnableConfigurationProperties(ReportProperties.class)
public class VexReportApplication {

	/**
	 * Boots the Spring container, runs the batch and exits with its status.
	 *
	 * @param args optional input path followed by {@code --vexreport.*} options
	 */
	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(VexReportApplication.class, args)));
	}

}
