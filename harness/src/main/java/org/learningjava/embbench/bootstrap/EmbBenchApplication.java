package org.learningjava.embbench.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.embbench")
public class EmbBenchApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(EmbBenchApplication.class, args)));
    }
}
