package com.retailpos.pricing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@org.springframework.scheduling.annotation.EnableScheduling
public class RetailPosApplication {

	public static void main(String[] args) {
		SpringApplication.run(RetailPosApplication.class, args);
	}

}
