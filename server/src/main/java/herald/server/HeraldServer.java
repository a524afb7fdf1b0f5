package herald.server;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication(scanBasePackages = {"herald.server", "herald.common"})
public class HeraldServer {

    public static void main(String[] args) {
        new SpringApplicationBuilder(HeraldServer.class).main(HeraldServer.class).web(WebApplicationType.NONE).run(args);
    }
}
