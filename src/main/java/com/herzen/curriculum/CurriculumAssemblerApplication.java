package com.herzen.curriculum;

import com.herzen.curriculum.config.CurriculumProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CurriculumProperties.class)
public class CurriculumAssemblerApplication {
    public static void main(String[] args) {
        SpringApplication.run(CurriculumAssemblerApplication.class, args);
    }
}
