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
 * Created on: 07-10-2026 at 12:40:06
 * File: DecryptionFailedException.java
 */

@Getter
public class DecryptionFailedException extends SftpExtractionException {

    private static final long serialVersionUID = 1L;

    private final String sourcePath;

    public DecryptionFailedException(String sourcePath) {
        super("Decryption of file failed: " + sourcePath);
        this.sourcePath = sourcePath;
    }

    public DecryptionFailedException(String message, String sourcePath) {
        super(message + ": " + sourcePath);
        this.sourcePath = sourcePath;
    }

    public DecryptionFailedException(String message, String sourcePath, Throwable cause) {
        super(message + ": " + sourcePath, cause);
        this.sourcePath = sourcePath;
    }
}
