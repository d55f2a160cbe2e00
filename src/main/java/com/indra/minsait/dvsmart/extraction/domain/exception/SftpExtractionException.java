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

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 05-10-2026 at 11:02:19
 * File: SftpExtractionException.java
 */

/**
 * Raíz de los errores que la extracción propaga al llamador.
 */
public class SftpExtractionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SftpExtractionException(String message) {
        super(message);
    }

    public SftpExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
