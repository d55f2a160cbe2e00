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

import lombok.Builder;
import lombok.Value;
import java.time.Instant;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 09-10-2026 at 11:18:50
 * File: TableExtractionRequest.java
 */

/**
 * Parámetros de una extracción: dónde buscar, qué ficheros aceptar y cómo leerlos.
 */
@Value
@Builder
public class TableExtractionRequest {
    String tableName;
    String searchPrefix;
    String searchPattern;
    Instant modifiedSince;           // Cota inferior exclusiva, null = todos
    DecryptionSettings decryption;   // null = ficheros en claro
    @Builder.Default
    CsvOptions csvOptions = CsvOptions.defaults();
}
