package com.whereq.warden.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Outbound connection settings carried by a pooled handle
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionConfig {
    @Builder.Default
    private String userAgent = "Warden/1.0";

    @Builder.Default
    private Duration connectTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private boolean followRedirects = true;

    @Builder.Default
    private int maxRedirects = 5;

    @Builder.Default
    private boolean verifyTls = true;
}
