package com.example.datalake.kbsearch;

import com.example.datalake.kbsearch.config.KbSearchProperties;
import com.example.datalake.kbsearch.config.Langchain4jOpenAiProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({KbSearchProperties.class, Langchain4jOpenAiProperties.class})
public class KbSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(KbSearchApplication.class, args);
    }

}
