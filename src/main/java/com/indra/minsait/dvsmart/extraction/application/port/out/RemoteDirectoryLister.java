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

import com.indra.minsait.dvsmart.extraction.domain.model.SftpFileEntry;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 08-10-2026 at 09:33:17
 * File: RemoteDirectoryLister.java
 */

/**
 * Listado de los hijos inmediatos de un directorio remoto.
 */
@FunctionalInterface
public interface RemoteDirectoryLister {

    /**
     * @param path ruta separada por '/'
     * @return entradas del directorio sin "." ni ".."
     * @throws com.indra.minsait.dvsmart.extraction.domain.exception.RemoteDirectoryNotFoundException
     *         si la ruta no existe
     */
    List<SftpFileEntry> listDirectory(String path);
}
