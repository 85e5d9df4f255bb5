package com.ridwan.slackexport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
public class SlackExportApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SlackExportApplication.class, args)));
    }

}
