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
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 12-10-2026 at 10:21:37
 * File: ExtractionConfigProperties.java
 */

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "extraction")
public class ExtractionConfigProperties {

    // Si es false la aplicación arranca sin lanzar extracciones
    private boolean enabled = false;

    @Valid
    private List<Table> tables = new ArrayList<>();

    @Getter
    @Setter
    public static class Table {
        @NotBlank
        private String tableName;
        private String searchPrefix;
        @NotBlank
        private String searchPattern;
        private Instant modifiedSince;       // ISO-8601, p.ej. 2026-01-01T00:00:00Z
        private List<String> keyProperties = new ArrayList<>();
        private List<String> dateOverrides = new ArrayList<>();
        @Size(min = 1, max = 1)
        private String delimiter = ",";
        private String encoding = "utf-8";
        private boolean sanitizeHeaders = false;
        private Decryption decryption;       // null = sin cifrar
    }

    @Getter
    @Setter
    public static class Decryption {
        private String key;
        private String gnupghome;
        private String passphrase;
    }
}
