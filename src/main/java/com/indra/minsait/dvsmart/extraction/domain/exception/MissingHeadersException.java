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
package com.indra.minsait.dvsmart.extraction.domain.exception;

import lombok.Getter;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 06-10-2026 at 13:15:22
 * File: MissingHeadersException.java
 */

/**
 * La cabecera del fichero no contiene columnas que la configuración exige.
 * Se lanza antes de leer ninguna fila.
 */
@Getter
public class MissingHeadersException extends SftpExtractionException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        KEY_PROPERTIES("required"),
        DATE_OVERRIDES("date_overrides");

        private final String label;

        Kind(String label) {
            this.label = label;
        }
    }

    private final Kind kind;
    private final Set<String> missingColumns;

    public MissingHeadersException(Kind kind, Set<String> missingColumns) {
        super("CSV file missing " + kind.label + " headers: " + new TreeSet<>(missingColumns));
        this.kind = kind;
        this.missingColumns = Collections.unmodifiableSet(new TreeSet<>(missingColumns));
    }
}
