package herald.common.configuration;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "herald.http")
public class HttpProperties {

    @NotBlank
    private String ip = "0.0.0.0";
    @NotNull
    @Min(0)
    private Integer port = 8080;
    private int shutdownQuietPeriod = 2;
    @Min(1)
    private int maxContentLength = 65536;
    @Valid
    @NestedConfigurationProperty
    private CorsProperties cors = new CorsProperties();

    public String getIp() {
        return ip;
    }

    public void setIp(String ip) {
        this.ip = ip;
    }

    /**
     * Port to listen on, 0 picks a free port.
     */
    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    /**
     * Time to wait (in seconds) for connections to finish and to make sure no new connections happen before shutting down Netty event loop groups.
     */
    public int getShutdownQuietPeriod() {
        return shutdownQuietPeriod;
    }

    public void setShutdownQuietPeriod(int shutdownQuietPeriod) {
        this.shutdownQuietPeriod = shutdownQuietPeriod;
    }

    public int getMaxContentLength() {
        return maxContentLength;
    }

    public void setMaxContentLength(int maxContentLength) {
        this.maxContentLength = maxContentLength;
    }

    public CorsProperties getCors() {
        return cors;
    }

    public void setCors(CorsProperties cors) {
        this.cors = cors;
    }
}
