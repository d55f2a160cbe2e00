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
import lombok.Singular;
import lombok.Value;
import java.util.Set;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 06-10-2026 at 10:05:58
 * File: CsvOptions.java
 */

/**
 * Opciones reconocidas por el parser de filas.
 */
@Value
@Builder(toBuilder = true)
public class CsvOptions {

    @Builder.Default
    String encoding = "utf-8";

    @Builder.Default
    char delimiter = ',';

    boolean sanitizeHeaders;

    @Singular
    Set<String> keyProperties;

    @Singular
    Set<String> dateOverrides;

    // Nombre del fichero de origen, usado para inferir la compresión
    String fileName;

    public static CsvOptions defaults() {
        return CsvOptions.builder().build();
    }
}
