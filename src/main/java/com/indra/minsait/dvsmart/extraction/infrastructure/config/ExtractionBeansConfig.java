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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.indra.minsait.dvsmart.extraction.adapter.out.compression.DecompressionStage;
import com.indra.minsait.dvsmart.extraction.adapter.out.csv.CsvRowParser;
import com.indra.minsait.dvsmart.extraction.adapter.out.decryption.GpgFileDecryptor;
import com.indra.minsait.dvsmart.extraction.adapter.out.sink.JsonLinesRecordSink;
import com.indra.minsait.dvsmart.extraction.application.port.out.FileDecryptor;
import com.indra.minsait.dvsmart.extraction.application.port.out.RecordSink;
import com.indra.minsait.dvsmart.extraction.infrastructure.retry.ExponentialBackoff;
import com.indra.minsait.dvsmart.extraction.infrastructure.retry.Sleeper;
import com.indra.minsait.dvsmart.extraction.infrastructure.sftp.ConnectionSettings;
import com.indra.minsait.dvsmart.extraction.infrastructure.sftp.SftpConnectionFactory;
import com.indra.minsait.dvsmart.extraction.infrastructure.sftp.SftpTransportFactory;
import com.indra.minsait.dvsmart.extraction.infrastructure.sftp.SshdSftpTransportFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import java.time.Duration;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 12-10-2026 at 10:48:02
 * File: ExtractionBeansConfig.java
 */

/**
 * Configuración de la conexión SFTP y de las etapas del pipeline.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ExtractionBeansConfig {

    private final SftpConfigProperties props;

    @Bean
    SftpTransportFactory sftpTransportFactory() {
        return new SshdSftpTransportFactory();
    }

    @Bean
    FileDecryptor fileDecryptor() {
        return new GpgFileDecryptor(props.getDecryption().getGpgExecutable());
    }

    @Bean
    ExponentialBackoff connectBackoff() {
        SftpConfigProperties.Retry retry = props.getRetry();
        return new ExponentialBackoff(
                retry.getMaxAttempts(),
                Duration.ofMillis(retry.getInitialDelayMillis()),
                retry.getMultiplier(),
                Sleeper.SYSTEM);
    }

    /**
     * Factory de conexiones: cada extracción obtiene una instancia propia.
     */
    @Bean
    SftpConnectionFactory sftpConnectionFactory(
            SftpTransportFactory transportFactory,
            ExponentialBackoff connectBackoff,
            FileDecryptor fileDecryptor) {

        SftpConfigProperties.Origin origin = props.getOrigin();
        ConnectionSettings settings = ConnectionSettings.builder()
                .host(origin.getHost())
                .port(origin.getPort())
                .username(origin.getUser())
                .password(origin.getPassword())
                .privateKeyFile(ConnectionSettings.expandUserHome(origin.getPrivateKeyFile()))
                .timeout(Duration.ofMillis(origin.getTimeout()))
                .readTimeout(Duration.ofMillis(origin.getReadTimeout()))
                .build();

        log.info("SFTP connection factory configured for {}@{}:{} (key={})",
                origin.getUser(), origin.getHost(), origin.getPort(), settings.hasPrivateKey());

        return new SftpConnectionFactory(settings, transportFactory, connectBackoff, fileDecryptor);
    }

    @Bean
    DecompressionStage decompressionStage() {
        return new DecompressionStage();
    }

    @Bean
    CsvRowParser csvRowParser(DecompressionStage decompressionStage) {
        return new CsvRowParser(decompressionStage);
    }

    @Bean
    @ConditionalOnMissingBean(RecordSink.class)
    RecordSink recordSink(ObjectMapper objectMapper) {
        return new JsonLinesRecordSink(objectMapper, System.out);
    }
}
