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
package com.indra.minsait.dvsmart.extraction.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 06-10-2026 at 09:47:26
 * File: RowRecord.java
 */

/**
 * Fila de un fichero delimitado: valores por columna en el orden de la cabecera
 * más los valores sobrantes de filas con más campos que columnas.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RowRecord {

    /** Clave reservada para los valores que exceden la cabecera. */
    public static final String SDC_EXTRA_COLUMN = "_sdc_extra";

    private final Map<String, String> values;
    private final List<String> extra;
    private final long lineNumber;

    public RowRecord(Map<String, String> values, List<String> extra, long lineNumber) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.extra = List.copyOf(extra);
        this.lineNumber = lineNumber;
    }

    /**
     * Valor de la columna, null si la fila no llegó a informarla.
     */
    public String get(String column) {
        return values.get(column);
    }

    public boolean hasExtra() {
        return !extra.isEmpty();
    }

    /**
     * Vista mutable para el sink; incluye {@value #SDC_EXTRA_COLUMN} solo si hay sobrantes.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(values);
        if (hasExtra()) {
            map.put(SDC_EXTRA_COLUMN, extra);
        }
        return map;
    }
}
