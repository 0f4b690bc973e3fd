package com.example.certify;

import com.example.certify.interfaces.cli.BatchCertificationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Application entry point.
 * With transcript paths on the command line the application certifies them in batch mode and exits;
 * without them it serves the HTTP API.
 */
@SpringBootApplication
public class CertifyApplication {

	/**
	 * @param args transcript PDF paths and optional {@code --output-dir=<dir>}
	 */
	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(CertifyApplication.class);
		boolean batch = BatchCertificationRunner.hasTranscriptArguments(args);
		if (batch) {
			application.setWebApplicationType(WebApplicationType.NONE);
		}
		ConfigurableApplicationContext context = application.run(args);
		if (batch) {
			System.exit(SpringApplication.exit(context));
		}
	}

}
