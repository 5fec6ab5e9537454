package com.tablesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TablesyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(TablesyncApplication.class, args);
    }
}
