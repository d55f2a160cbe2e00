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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 07-10-2026 at 12:52:10
 * File: DecryptedFile.java
 */

/**
 * Fichero temporal con el texto en claro y el flujo abierto sobre él.
 * Al cerrarse libera el flujo y borra el fichero y su directorio temporal.
 */
@Slf4j
@Getter
public class DecryptedFile implements Closeable {

    private final Path path;
    private final Path workDirectory;
    private final InputStream stream;
    private boolean closed;

    private DecryptedFile(Path path, Path workDirectory, InputStream stream) {
        this.path = path;
        this.workDirectory = workDirectory;
        this.stream = stream;
    }

    public static DecryptedFile open(Path path, Path workDirectory) throws IOException {
        return new DecryptedFile(path, workDirectory, Files.newInputStream(path));
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            stream.close();
        } finally {
            Files.deleteIfExists(path);
            Files.deleteIfExists(workDirectory);
            log.debug("Decrypted temp file removed: {}", path);
        }
    }
}
