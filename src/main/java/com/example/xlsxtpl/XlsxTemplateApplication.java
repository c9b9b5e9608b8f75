package com.example.xlsxtpl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class XlsxTemplateApplication {

    public static void main(String[] args) {
        SpringApplication.run(XlsxTemplateApplication.class, args);
    }

}
