package org.iceforge.pruner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PrunerApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(PrunerApplication.class, args)));
	}

}
