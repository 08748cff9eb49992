package com.example.docverify;

import com.example.docverify.config.VerificationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(VerificationProperties.class)
public class DocVerifyApplication {

	public static void main(String[] args) {
		SpringApplication.run(DocVerifyApplication.class, args);
	}

}
