package decentralabs.gmp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GmpRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GmpRelayApplication.class, args);
    }
}
