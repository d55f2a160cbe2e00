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
package com.indra.minsait.dvsmart.extraction.infrastructure.sftp;

import com.indra.minsait.dvsmart.extraction.domain.model.SftpFileEntry;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 10-10-2026 at 10:11:52
 * File: SftpTransport.java
 */

/**
 * Sesión SFTP autenticada. Una instancia no es segura para uso concurrente.
 */
public interface SftpTransport extends Closeable {

    /**
     * @throws java.nio.file.NoSuchFileException si el directorio no existe
     */
    List<SftpFileEntry> list(String path) throws IOException;

    /**
     * @throws java.nio.file.NoSuchFileException si el fichero no existe
     */
    InputStream open(String path) throws IOException;

    boolean isOpen();
}
