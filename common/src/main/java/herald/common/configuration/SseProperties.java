package herald.common.configuration;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import herald.Constants;

@Validated
@ConfigurationProperties(prefix = "herald.sse")
public class SseProperties {

    @NotBlank
    private String path = Constants.DEFAULT_PATH;
    @NotBlank
    private String channelParameter = Constants.DEFAULT_CHANNEL_PARAMETER;
    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration pingInterval = Duration.ofSeconds(Constants.DEFAULT_PING_INTERVAL_SECONDS);
    private boolean exclusiveChannels = true;
    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration stopTimeout = Duration.ofSeconds(5);

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getChannelParameter() {
        return channelParameter;
    }

    public void setChannelParameter(String channelParameter) {
        this.channelParameter = channelParameter;
    }

    /**
     * Time between keep-alive comments sent to every subscriber.
     */
    public Duration getPingInterval() {
        return pingInterval;
    }

    public void setPingInterval(Duration pingInterval) {
        this.pingInterval = pingInterval;
    }

    /**
     * When true an explicit channel id can only be held by one connected subscriber.
     */
    public boolean isExclusiveChannels() {
        return exclusiveChannels;
    }

    public void setExclusiveChannels(boolean exclusiveChannels) {
        this.exclusiveChannels = exclusiveChannels;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    public void setStopTimeout(Duration stopTimeout) {
        this.stopTimeout = stopTimeout;
    }
}
