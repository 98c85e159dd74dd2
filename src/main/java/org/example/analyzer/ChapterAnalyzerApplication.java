package org.example.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChapterAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChapterAnalyzerApplication.class, args);
    }
}
