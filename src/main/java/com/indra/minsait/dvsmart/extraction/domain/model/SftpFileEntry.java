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

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 05-10-2026 at 10:12:41
 * File: SftpFileEntry.java
 */

/**
 * Representa una entrada del listado de un directorio SFTP.
 * Modelo intermedio antes de convertir a RemoteFileDescriptor.
 */
@Value
@Builder
public class SftpFileEntry {
    String filename;          // Nombre dentro del directorio listado (b.csv)
    Long size;                // Tamaño en bytes, null si el servidor no lo informa
    Long modificationTime;    // Epoch seconds, null si el servidor no lo informa
    boolean directory;        // true si los bits de modo indican directorio
}
