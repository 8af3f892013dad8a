package my.fundextractor.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FundExtractorApplication {
	public static void main(String[] args) {
		SpringApplication.run(FundExtractorApplication.class, args);
	}
}
