package dao.railroad.cargo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CargoLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CargoLedgerApplication.class, args);
    }
}
