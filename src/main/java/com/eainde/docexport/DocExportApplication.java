package com.eainde.docexport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocExportApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocExportApplication.class, args);
    }
}
