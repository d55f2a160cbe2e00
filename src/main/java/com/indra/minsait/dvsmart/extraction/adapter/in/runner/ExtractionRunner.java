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
package com.indra.minsait.dvsmart.extraction.adapter.in.runner;

import com.indra.minsait.dvsmart.extraction.application.port.in.ExtractTableUseCase;
import com.indra.minsait.dvsmart.extraction.application.port.out.RecordSink;
import com.indra.minsait.dvsmart.extraction.domain.model.CsvOptions;
import com.indra.minsait.dvsmart.extraction.domain.model.DecryptionSettings;
import com.indra.minsait.dvsmart.extraction.domain.model.ExtractionResult;
import com.indra.minsait.dvsmart.extraction.domain.model.TableExtractionRequest;
import com.indra.minsait.dvsmart.extraction.infrastructure.config.ExtractionConfigProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 12-10-2026 at 12:16:55
 * File: ExtractionRunner.java
 */

/**
 * Lanza al arrancar la extracción de cada tabla configurada, en secuencia.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "extraction", name = "enabled", havingValue = "true")
public class ExtractionRunner implements ApplicationRunner {

    private final ExtractTableUseCase extractTableUseCase;
    private final ExtractionConfigProperties props;
    private final RecordSink recordSink;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Running extraction for {} configured tables", props.getTables().size());

        for (ExtractionConfigProperties.Table table : props.getTables()) {
            ExtractionResult result = extractTableUseCase.execute(toRequest(table), recordSink);
            log.info("Table '{}': {} files, {} records, last modified {}",
                    result.getTableName(),
                    result.getFilesProcessed(),
                    result.getRecordsEmitted(),
                    result.getMaxLastModified());
        }
    }

    static TableExtractionRequest toRequest(ExtractionConfigProperties.Table table) {
        CsvOptions csvOptions = CsvOptions.builder()
                .encoding(table.getEncoding())
                .delimiter(table.getDelimiter().charAt(0))
                .sanitizeHeaders(table.isSanitizeHeaders())
                .keyProperties(table.getKeyProperties())
                .dateOverrides(table.getDateOverrides())
                .build();

        DecryptionSettings decryption = null;
        if (table.getDecryption() != null) {
            decryption = DecryptionSettings.builder()
                    .key(table.getDecryption().getKey())
                    .gnupgHome(table.getDecryption().getGnupghome())
                    .passphrase(table.getDecryption().getPassphrase())
                    .build();
        }

        return TableExtractionRequest.builder()
                .tableName(table.getTableName())
                .searchPrefix(table.getSearchPrefix())
                .searchPattern(table.getSearchPattern())
                .modifiedSince(table.getModifiedSince())
                .decryption(decryption)
                .csvOptions(csvOptions)
                .build();
    }
}
