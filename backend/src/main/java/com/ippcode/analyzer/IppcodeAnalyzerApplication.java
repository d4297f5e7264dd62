package com.ippcode.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

import com.ippcode.analyzer.cli.ParseCommandLineRunner;

@SpringBootApplication
@ConfigurationPropertiesScan
public class IppcodeAnalyzerApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(IppcodeAnalyzerApplication.class, args);

        // The cli profile runs once and leaves with the command's exit code
        if (!context.getBeansOfType(ParseCommandLineRunner.class).isEmpty()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
