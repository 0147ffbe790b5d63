package sp.sistemaspalacios.api_hrcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ApiHrcoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiHrcoreApplication.class, args);
    }
}
