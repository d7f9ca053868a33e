// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/EtoEnhancerApplication.java
package dev.devanks.agronomy.eto;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

@SpringBootApplication
@EnableFeignClients
public class EtoEnhancerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EtoEnhancerApplication.class, args);
    }
}
