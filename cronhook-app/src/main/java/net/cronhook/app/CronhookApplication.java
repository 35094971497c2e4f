package net.cronhook.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CronhookApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronhookApplication.class, args);
    }
}
