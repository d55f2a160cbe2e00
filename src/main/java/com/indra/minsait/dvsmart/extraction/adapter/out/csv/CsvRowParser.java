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
package com.indra.minsait.dvsmart.extraction.adapter.out.csv;

import com.indra.minsait.dvsmart.extraction.adapter.out.compression.DecompressionStage;
import com.indra.minsait.dvsmart.extraction.domain.exception.MissingHeadersException;
import com.indra.minsait.dvsmart.extraction.domain.exception.UnsupportedFileEncodingException;
import com.indra.minsait.dvsmart.extraction.domain.model.CsvOptions;
import com.indra.minsait.dvsmart.extraction.domain.model.NamedStream;
import com.indra.minsait.dvsmart.extraction.domain.service.HeaderSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 06-10-2026 at 14:02:45
 * File: CsvRowParser.java
 */

/**
 * Convierte flujos de bytes en iteradores de filas.
 *
 * La primera línea es la cabecera. Las columnas exigidas (key_properties y
 * date_overrides) se validan contra ella antes de leer ninguna fila.
 */
@Slf4j
public class CsvRowParser {

    // Python-style: UTF-8 descartando el BOM inicial
    private static final String UTF8_SIG = "utf-8-sig";

    private final DecompressionStage decompression;

    public CsvRowParser(DecompressionStage decompression) {
        this.decompression = decompression;
    }

    /**
     * Un iterador de filas por cada miembro del fichero (varios si es un zip).
     *
     * @param inferCompression si es false el flujo se trata como texto plano
     */
    public Iterator<CsvRowIterator> rowIterators(InputStream in, CsvOptions options, boolean inferCompression)
            throws IOException {

        Iterator<NamedStream> members = inferCompression
                ? decompression.expand(in, options.getFileName())
                : Collections.singletonList(new NamedStream(options.getFileName(), in)).iterator();

        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return members.hasNext();
            }

            @Override
            public CsvRowIterator next() {
                NamedStream member = members.next();
                log.debug("Reading rows from {}", member.getName());
                try {
                    return parseRows(member.getStream(), options);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to read " + member.getName(), e);
                }
            }
        };
    }

    public CsvRowIterator parseRows(InputStream in, CsvOptions options) throws IOException {
        Charset charset = charset(options.getEncoding(), options.getFileName());

        // Lectura tolerante: texto tras una comilla de cierre ("x"y -> xy) y comilla sin cerrar al final
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(options.getDelimiter())
                .setIgnoreEmptyLines(true)
                .setTrailingData(true)
                .setLenientEof(true)
                .build();

        CSVParser parser = format.parse(new InputStreamReader(decode(in, options.getEncoding()), charset));
        Iterator<CSVRecord> records = parser.iterator();

        List<String> headers = new ArrayList<>();
        if (records.hasNext()) {
            CSVRecord header = records.next();
            for (int i = 0; i < header.size(); i++) {
                headers.add(header.get(i));
            }
        } else {
            log.warn("File {} has no header row", options.getFileName());
        }

        if (options.isSanitizeHeaders()) {
            headers = HeaderSanitizer.sanitizeAll(headers);
        }

        try {
            validateHeaders(headers, options);
        } catch (MissingHeadersException e) {
            parser.close();
            throw e;
        }

        return new CsvRowIterator(parser, records, headers);
    }

    static void validateHeaders(List<String> headers, CsvOptions options) {
        Set<String> available = new HashSet<>(headers);

        Set<String> missingKeys = missing(options.getKeyProperties(), available);
        if (!missingKeys.isEmpty()) {
            throw new MissingHeadersException(MissingHeadersException.Kind.KEY_PROPERTIES, missingKeys);
        }

        Set<String> missingDates = missing(options.getDateOverrides(), available);
        if (!missingDates.isEmpty()) {
            throw new MissingHeadersException(MissingHeadersException.Kind.DATE_OVERRIDES, missingDates);
        }
    }

    private static Set<String> missing(Set<String> required, Set<String> available) {
        Set<String> missing = new HashSet<>(required);
        missing.removeAll(available);
        return missing;
    }

    private static InputStream decode(InputStream in, String encoding) throws IOException {
        if (isUtf8Sig(encoding)) {
            return BOMInputStream.builder().setInputStream(in).get();
        }
        return in;
    }

    private static boolean isUtf8Sig(String encoding) {
        return encoding != null && UTF8_SIG.equalsIgnoreCase(encoding.trim().replace('_', '-'));
    }

    /**
     * Resuelve el charset admitiendo también los nombres de Python (latin-1, utf_8, cp1252...).
     */
    static Charset charset(String encoding, String fileName) {
        if (encoding == null || isUtf8Sig(encoding)) {
            return StandardCharsets.UTF_8;
        }

        String name = encoding.trim();
        List<String> candidates = List.of(
                name,
                name.replace('_', '-'),
                name.replace("-", "").replace("_", ""));
        try {
            for (String candidate : candidates) {
                if (Charset.isSupported(candidate)) {
                    return Charset.forName(candidate);
                }
            }
        } catch (IllegalArgumentException e) {
            throw new UnsupportedFileEncodingException(encoding, fileName, e);
        }
        throw new UnsupportedFileEncodingException(encoding, fileName, null);
    }
}
