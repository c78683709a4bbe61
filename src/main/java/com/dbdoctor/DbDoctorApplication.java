package com.dbdoctor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DbDoctorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DbDoctorApplication.class, args)));
    }
}
