package com.copyleft.Treachery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class TreacheryApplication {

	public static void main(String[] args) {
		SpringApplication.run(TreacheryApplication.class, args);
	}

}
