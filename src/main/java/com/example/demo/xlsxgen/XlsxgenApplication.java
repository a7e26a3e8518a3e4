package com.example.demo.xlsxgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class XlsxgenApplication {

	public static void main(String[] args) {
		SpringApplication.run(XlsxgenApplication.class, args);
	}

}
