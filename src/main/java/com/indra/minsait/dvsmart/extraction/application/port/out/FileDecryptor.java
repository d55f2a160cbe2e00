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

import com.indra.minsait.dvsmart.extraction.domain.model.DecryptedFile;
import com.indra.minsait.dvsmart.extraction.domain.model.DecryptionSettings;
import java.io.IOException;
import java.io.InputStream;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 07-10-2026 at 12:35:44
 * File: FileDecryptor.java
 */
public interface FileDecryptor {

    /**
     * Descifra {@code encrypted} a un fichero temporal propio de la llamada.
     *
     * @param sourcePath ruta remota, da nombre al fichero en claro y a los errores
     * @throws com.indra.minsait.dvsmart.extraction.domain.exception.DecryptionFailedException
     *         si la herramienta no deja fichero de salida
     */
    DecryptedFile decrypt(InputStream encrypted, String sourcePath, DecryptionSettings settings) throws IOException;
}
