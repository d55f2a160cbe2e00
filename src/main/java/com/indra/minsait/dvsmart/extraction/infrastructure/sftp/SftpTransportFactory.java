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

import java.io.IOException;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 10-10-2026 at 10:15:36
 * File: SftpTransportFactory.java
 */
@FunctionalInterface
public interface SftpTransportFactory {

    /**
     * Abre transporte, autentica y abre el canal SFTP en un único intento.
     *
     * @param useKey autenticar con la clave privada de {@code settings}; si es false, solo password
     * @throws java.io.EOFException la conexión se cerró antes de completar el handshake (transitorio)
     * @throws SftpAuthenticationException el servidor rechazó las credenciales
     * @throws IOException cualquier otro fallo, no se reintenta
     */
    SftpTransport open(ConnectionSettings settings, boolean useKey) throws IOException;
}
