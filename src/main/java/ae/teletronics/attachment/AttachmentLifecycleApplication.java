package ae.teletronics.attachment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AttachmentLifecycleApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttachmentLifecycleApplication.class, args);
    }
}
