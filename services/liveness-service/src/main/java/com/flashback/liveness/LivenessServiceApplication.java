package com.flashback.liveness;

import com.flashback.common.exception.GlobalExceptionHandler;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@Import(GlobalExceptionHandler.class)
public class LivenessServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LivenessServiceApplication.class, args);
    }
}
