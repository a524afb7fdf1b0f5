package herald.server.configuration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import herald.common.configuration.HttpProperties;
import herald.common.configuration.SseProperties;
import herald.server.Server;
import herald.sse.EventStreamService;

@Configuration
public class HeraldConfiguration {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public Server server(ApplicationContext applicationContext, EventStreamService eventStreamService, HttpProperties httpProperties,
                    SseProperties sseProperties) {
        Server server = new Server(applicationContext, eventStreamService, httpProperties, sseProperties);
        server.start();
        return server;
    }
}
