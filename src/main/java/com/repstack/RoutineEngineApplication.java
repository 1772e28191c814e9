package com.repstack;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@MapperScan("com.repstack.mapper")
public class RoutineEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoutineEngineApplication.class, args);
    }
}
