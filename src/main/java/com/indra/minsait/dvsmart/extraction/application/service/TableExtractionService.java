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
package com.indra.minsait.dvsmart.extraction.application.service;

import com.indra.minsait.dvsmart.extraction.adapter.out.csv.CsvRowIterator;
import com.indra.minsait.dvsmart.extraction.adapter.out.csv.CsvRowParser;
import com.indra.minsait.dvsmart.extraction.application.port.in.ExtractTableUseCase;
import com.indra.minsait.dvsmart.extraction.application.port.out.RecordSink;
import com.indra.minsait.dvsmart.extraction.domain.exception.RemoteOperationException;
import com.indra.minsait.dvsmart.extraction.domain.model.CsvOptions;
import com.indra.minsait.dvsmart.extraction.domain.model.ExtractionResult;
import com.indra.minsait.dvsmart.extraction.domain.model.RemoteFileDescriptor;
import com.indra.minsait.dvsmart.extraction.domain.model.RowRecord;
import com.indra.minsait.dvsmart.extraction.domain.model.TableExtractionRequest;
import com.indra.minsait.dvsmart.extraction.domain.service.FileDiscoveryService;
import com.indra.minsait.dvsmart.extraction.infrastructure.sftp.SftpConnection;
import com.indra.minsait.dvsmart.extraction.infrastructure.sftp.SftpConnectionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 09-10-2026 at 12:04:33
 * File: TableExtractionService.java
 */

/**
 * Extracción de una tabla completa.
 *
 * Flujo:
 * 1. Abre una conexión propia (se cierra siempre al terminar)
 * 2. Descubre los ficheros que cumplen patrón y fecha
 * 3. Los procesa en orden de modificación: descifrado, descompresión, parseo
 * 4. Entrega cada fila al sink con el fichero y la línea de origen
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableExtractionService implements ExtractTableUseCase {

    public static final String SDC_SOURCE_FILE_COLUMN = "_sdc_source_file";
    public static final String SDC_SOURCE_LINENO_COLUMN = "_sdc_source_lineno";

    private final SftpConnectionFactory connectionFactory;
    private final FileDiscoveryService discoveryService;
    private final CsvRowParser rowParser;

    @Override
    public ExtractionResult execute(TableExtractionRequest request, RecordSink sink) {
        String tableName = request.getTableName();
        log.info("Starting extraction for table '{}'", tableName);
        long startTime = System.currentTimeMillis();

        int filesProcessed = 0;
        long recordsEmitted = 0;
        Instant maxLastModified = null;

        try (SftpConnection connection = connectionFactory.create()) {
            connection.ensureConnected();

            List<RemoteFileDescriptor> files = new ArrayList<>(discoveryService.getFilesForTable(
                    connection,
                    tableName,
                    request.getSearchPrefix(),
                    request.getSearchPattern(),
                    request.getModifiedSince()));

            // Orden por fecha para que la última procesada sirva como marca incremental
            files.sort(Comparator.comparing(RemoteFileDescriptor::getLastModified));

            for (RemoteFileDescriptor file : files) {
                long records = syncFile(connection, file, request, sink);
                log.info("Wrote {} records for table '{}' from {}", records, tableName, file.getFilepath());

                filesProcessed++;
                recordsEmitted += records;
                maxLastModified = file.getLastModified();
            }
        }

        sink.flush();

        long duration = System.currentTimeMillis() - startTime;
        log.info("Extraction for table '{}' completed in {} ms: {} files, {} records",
                tableName, duration, filesProcessed, recordsEmitted);

        return ExtractionResult.builder()
                .tableName(tableName)
                .filesProcessed(filesProcessed)
                .recordsEmitted(recordsEmitted)
                .maxLastModified(maxLastModified)
                .build();
    }

    private long syncFile(
            SftpConnection connection,
            RemoteFileDescriptor file,
            TableExtractionRequest request,
            RecordSink sink) {

        String path = file.getFilepath();
        log.info("Syncing file \"{}\"", path);

        long records = 0;
        try (InputStream handle = connection.getFileHandle(file, request.getDecryption())) {
            // Tras descifrar, la compresión se deduce del nombre del fichero en claro (x.csv.gz.gpg -> x.csv.gz)
            String contentName = connection.getDecryptedFile()
                    .map(decrypted -> decrypted.getPath().getFileName().toString())
                    .orElse(path);
            CsvOptions options = request.getCsvOptions().toBuilder()
                    .fileName(contentName)
                    .build();

            Iterator<CsvRowIterator> readers = rowParser.rowIterators(handle, options, true);
            while (readers.hasNext()) {
                try (CsvRowIterator rows = readers.next()) {
                    while (rows.hasNext()) {
                        RowRecord row = rows.next();
                        Map<String, Object> record = row.toMap();
                        record.put(SDC_SOURCE_FILE_COLUMN, path);
                        record.put(SDC_SOURCE_LINENO_COLUMN, row.getLineNumber());
                        sink.write(request.getTableName(), record);
                        records++;
                    }
                }
            }
        } catch (IOException e) {
            throw new RemoteOperationException("Failed to read file", path, e);
        } catch (UncheckedIOException e) {
            throw new RemoteOperationException("Failed to read file", path, e.getCause());
        }
        return records;
    }
}
