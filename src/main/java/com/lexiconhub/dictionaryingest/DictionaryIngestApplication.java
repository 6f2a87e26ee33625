package com.lexiconhub.dictionaryingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DictionaryIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(DictionaryIngestApplication.class, args);
    }
}
