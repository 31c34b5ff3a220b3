package email.labeler.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.PropertySource;

@PropertySource(value = "file:./config/secrets.properties", ignoreResourceNotFound = true)
@SpringBootApplication
public class EmailLabelerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmailLabelerApplication.class, args);
    }

}
