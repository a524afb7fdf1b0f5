package herald.common.configuration;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import herald.sse.EventStreamService;
import herald.sse.SubscribeHook;
import herald.subscription.SubscriptionRegistry;

@Configuration
@EnableConfigurationProperties({HttpProperties.class, SseProperties.class})
public class HeraldCommonConfiguration {

    // closed by EventStreamService.stop()
    @Bean(destroyMethod = "")
    public SubscriptionRegistry subscriptionRegistry(SseProperties sseProperties) {
        return new SubscriptionRegistry(sseProperties.isExclusiveChannels());
    }

    @Bean
    public EventStreamService eventStreamService(SubscriptionRegistry subscriptionRegistry, SseProperties sseProperties,
                    ObjectProvider<SubscribeHook> subscribeHook) {
        EventStreamService eventStreamService = new EventStreamService(subscriptionRegistry, sseProperties);
        subscribeHook.ifAvailable(eventStreamService::setBeforeSubscribeHook);
        return eventStreamService;
    }
}
