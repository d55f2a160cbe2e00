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

import com.indra.minsait.dvsmart.extraction.application.port.out.FileDecryptor;
import com.indra.minsait.dvsmart.extraction.infrastructure.retry.ExponentialBackoff;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 11-10-2026 at 10:47:03
 * File: SftpConnectionFactory.java
 */

/**
 * Crea una SftpConnection nueva por llamada. Las conexiones no comparten estado,
 * así que el paralelismo entre tablas se consigue dando una a cada worker.
 */
@Slf4j
@Getter
public class SftpConnectionFactory {

    private final ConnectionSettings settings;
    private final SftpTransportFactory transportFactory;
    private final ExponentialBackoff backoff;
    private final FileDecryptor decryptor;

    public SftpConnectionFactory(
            ConnectionSettings settings,
            SftpTransportFactory transportFactory,
            ExponentialBackoff backoff,
            FileDecryptor decryptor) {
        this.settings = settings;
        this.transportFactory = transportFactory;
        this.backoff = backoff;
        this.decryptor = decryptor;
    }

    public SftpConnection create() {
        log.debug("Creating SFTP connection for {}@{}:{}",
                settings.getUsername(), settings.getHost(), settings.getPort());
        return new SftpConnection(settings, transportFactory, backoff, decryptor);
    }
}
