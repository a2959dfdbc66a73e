package org.operaton.rungrade;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application class for RunGrade.
 * RunGrade splits recorded GPX and FIT activities into fixed-distance bins and relates
 * running pace to terrain gradient across many runs.
 */
@SpringBootApplication
@EnableScheduling
@Slf4j
public class RunGradeApplication {

    public static void main(String[] args) {
        SpringApplication.run(RunGradeApplication.class, args);
        log.info("RunGrade application started successfully!");
    }
}
