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

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 05-10-2026 at 11:09:48
 * File: RemoteOperationException.java
 */

/**
 * Error de E/S al listar o leer una ruta remota ya conectada.
 */
@Getter
public class RemoteOperationException extends SftpExtractionException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public RemoteOperationException(String message, String path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }
}
