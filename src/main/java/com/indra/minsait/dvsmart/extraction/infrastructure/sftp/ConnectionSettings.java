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
package com.indra.minsait.dvsmart.extraction.infrastructure.sftp;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 10-10-2026 at 10:03:27
 * File: ConnectionSettings.java
 */

@Value
@Builder
public class ConnectionSettings {

    String host;

    @Builder.Default
    int port = 22;

    String username;

    @ToString.Exclude
    String password;

    Path privateKeyFile;

    // Connect y autenticación
    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);

    // Lectura de socket sin datos; acota listados y lecturas colgados
    @Builder.Default
    Duration readTimeout = Duration.ofMinutes(5);

    public boolean hasPrivateKey() {
        return privateKeyFile != null;
    }

    /**
     * Resuelve un "~" inicial contra el home del usuario.
     */
    public static Path expandUserHome(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        if (path.equals("~") || path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + path.substring(1));
        }
        return Paths.get(path);
    }
}
