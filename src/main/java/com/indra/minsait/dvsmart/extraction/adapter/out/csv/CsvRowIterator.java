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

import com.indra.minsait.dvsmart.extraction.domain.model.RowRecord;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 06-10-2026 at 15:37:12
 * File: CsvRowIterator.java
 */

/**
 * Recorre las filas de un fichero delimitado mapeándolas contra la cabecera.
 *
 * Solo avanza y no se puede reiniciar: para releer hay que abrir de nuevo el fichero.
 */
public class CsvRowIterator implements Iterator<RowRecord>, Closeable {

    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private final List<String> headers;

    CsvRowIterator(CSVParser parser, Iterator<CSVRecord> records, List<String> headers) {
        this.parser = parser;
        this.records = records;
        this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
    }

    public List<String> getHeaders() {
        return headers;
    }

    @Override
    public boolean hasNext() {
        return records.hasNext();
    }

    @Override
    public RowRecord next() {
        CSVRecord record = records.next();

        // Campos que faltan al final quedan a null; los que sobran van a _sdc_extra
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            values.put(headers.get(i), i < record.size() ? record.get(i) : null);
        }

        List<String> extra = new ArrayList<>();
        for (int i = headers.size(); i < record.size(); i++) {
            extra.add(record.get(i));
        }

        return new RowRecord(values, extra, record.getRecordNumber());
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
