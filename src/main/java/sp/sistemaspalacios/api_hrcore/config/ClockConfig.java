package sp.sistemaspalacios.api_hrcore.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single time source for "today". Rules never call {@code now()} without it.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${hrcore.timezone:Asia/Kolkata}") String timezone) {
        return Clock.system(ZoneId.of(timezone));
    }
}
