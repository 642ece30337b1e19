package com.affinity.x;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AffinityXApplication {

	public static void main(String[] args) {
		SpringApplication.run(AffinityXApplication.class, args);
	}

}
