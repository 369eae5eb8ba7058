package com.querydesk.portal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class QueryDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryDeskApplication.class, args);
    }

}
