package com.dispatchplatform.broadcast.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "dispatch.broadcast")
public class BroadcastProperties {

    private List<String> cities = new ArrayList<>(List.of("nyc", "mpls"));

    /** City served to clients that do not name one, or name one that is not configured. */
    private String defaultCity = "nyc";

    /** Events buffered per city sink for subscribers that fall behind. */
    private int bufferSize = 64;
}
