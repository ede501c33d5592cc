package quest.gekko.kolmetrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class KolMetricsApplication {

    public static void main(String[] args) {
        SpringApplication.run(KolMetricsApplication.class, args);
    }

}
