/*
 * /////////////////////////////////////////////////////////////////////////////
 *
 * Copyright (c) 2026 Indra Sistemas, S.A. All Rights Reserved.
 * http://www.indracompany.com/
 *
 * The contents of this file are owned by Indra Sistemas, S.A. copyright holder.
 * This file can only be copied, distributed and used all or in part with the
 * written permission of Indra Sistemas, S.A, or in accordance with the terms and
 * conditions laid down in the agreement / contract under which supplied.
 *
 * /////////////////////////////////////////////////////////////////////////////
 */
package com.indra.minsait.dvsmart.extraction.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 12-10-2026 at 10:05:44
 * File: SftpConfigProperties.java
 */

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "sftp")
public class SftpConfigProperties {

    @Valid
    private Origin origin = new Origin();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Discovery discovery = new Discovery();

    private Decryption decryption = new Decryption();

    @Getter
    @Setter
    public static class Origin {
        @NotBlank
        private String host;
        private int port = 22;
        @NotBlank
        private String user;
        private String password;
        private String privateKeyFile;       // Admite "~/"
        private int timeout = 30000;         // Connect y auth (ms)
        private long readTimeout = 300000;   // Socket sin datos (ms), 0 = sin límite
    }

    @Getter
    @Setter
    public static class Retry {
        // 5 esperas: 2 + 4 + 8 + 16 + 32 s
        @Min(1)
        private int maxAttempts = 6;
        private long initialDelayMillis = 2000;
        private double multiplier = 2.0;
    }

    @Getter
    @Setter
    public static class Discovery {
        @Min(0)
        private int maxDepth = 64;
    }

    @Getter
    @Setter
    public static class Decryption {
        private String gpgExecutable = "gpg";
    }
}
