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
package com.indra.minsait.dvsmart.extraction.domain.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 06-10-2026 at 12:48:33
 * File: HeaderSanitizer.java
 */

/**
 * Normaliza nombres de columna a identificadores válidos.
 *
 * <ul>
 *   <li>Cada tramo de caracteres fuera de [0-9a-zA-Z_] se sustituye por un único '_'</li>
 *   <li>Un prefijo numérico recibe el marcador "x_" delante</li>
 *   <li>El resultado se pasa a minúsculas</li>
 * </ul>
 */
public final class HeaderSanitizer {

    private static final Pattern INVALID_RUN = Pattern.compile("[^0-9a-zA-Z_]+");
    private static final Pattern LEADING_DIGITS = Pattern.compile("^(\\d+)");

    private HeaderSanitizer() {
    }

    public static String sanitize(String columnName) {
        String sanitized = INVALID_RUN.matcher(columnName).replaceAll("_");
        String prefixed = LEADING_DIGITS.matcher(sanitized).replaceFirst("x_$1");
        return prefixed.toLowerCase(Locale.ROOT);
    }

    public static List<String> sanitizeAll(List<String> columnNames) {
        List<String> result = new ArrayList<>(columnNames.size());
        for (String name : columnNames) {
            result.add(sanitize(name));
        }
        return result;
    }
}
