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
package com.indra.minsait.dvsmart.extraction.application.port.out;

import java.util.Map;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 09-10-2026 at 10:58:44
 * File: RecordSink.java
 */

/**
 * Consumidor de registros extraídos. El esquema y el estado persistido son
 * responsabilidad de la implementación.
 */
public interface RecordSink {

    void write(String tableName, Map<String, Object> record);

    default void flush() {
    }
}
