package com.eventdaemon.config;

import com.eventdaemon.gateway.ConnectionConfig;
import com.eventdaemon.gateway.GatewayMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

/**
 * Gateway connection settings, bound from {@code gateway.*}. application.properties maps the
 * {@code IB_*} environment variables onto these properties.
 */
@Configuration
@ConfigurationProperties(prefix = "gateway")
@Validated
@Getter
@Setter
public class GatewayConfig {

    @NotBlank(message = "Host cannot be empty")
    private String host = "127.0.0.1";

    @Min(0)
    @Max(65535)
    private int port = 7497;

    @Positive
    private int clientId = 1;

    /** Connection timeout in seconds. */
    @Positive
    private double timeout = 4.0;

    private boolean readonly = false;

    private String account = "";

    @NotNull
    private GatewayMode mode = GatewayMode.SIMULATED;

    @Valid
    private Kite kite = new Kite();

    @AssertTrue(message = "gateway.kite.api-key and gateway.kite.access-token are required in LIVE mode")
    public boolean isLiveCredentialsPresent() {
        return mode != GatewayMode.LIVE
                || (StringUtils.hasText(kite.getApiKey()) && StringUtils.hasText(kite.getAccessToken()));
    }

    public ConnectionConfig toConnectionConfig() {
        return ConnectionConfig.builder()
                .host(host)
                .port(port)
                .clientId(clientId)
                .timeout(Duration.ofMillis(Math.round(timeout * 1000)))
                .readonly(readonly)
                .account(account != null ? account : "")
                .build();
    }

    @Getter
    @Setter
    public static class Kite {

        /** Kite Connect API key (from Zerodha developer console). */
        private String apiKey = "";

        /** Access token of an authenticated Kite session. */
        private String accessToken = "";
    }
}
