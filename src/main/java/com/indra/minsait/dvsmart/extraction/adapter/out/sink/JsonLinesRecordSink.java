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
package com.indra.minsait.dvsmart.extraction.adapter.out.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.indra.minsait.dvsmart.extraction.application.port.out.RecordSink;
import lombok.extern.slf4j.Slf4j;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 12-10-2026 at 09:40:18
 * File: JsonLinesRecordSink.java
 */

/**
 * Escribe un JSON por línea: {"type":"RECORD","stream":tabla,"record":{...}}.
 */
@Slf4j
public class JsonLinesRecordSink implements RecordSink {

    private final ObjectMapper objectMapper;
    private final PrintStream out;

    public JsonLinesRecordSink(ObjectMapper objectMapper, PrintStream out) {
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void write(String tableName, Map<String, Object> record) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "RECORD");
        message.put("stream", tableName);
        message.put("record", record);
        try {
            out.println(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize record for table " + tableName, e);
        }
    }

    @Override
    public void flush() {
        out.flush();
    }
}
