package de.vzg.pubmed.tools;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PubMedToolsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PubMedToolsApplication.class, args);
    }
}
