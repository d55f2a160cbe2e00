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
import lombok.ToString;
import lombok.Value;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 07-10-2026 at 12:31:14
 * File: DecryptionSettings.java
 */

@Value
@Builder
public class DecryptionSettings {
    String key;          // Identificador de la clave privada
    String gnupgHome;    // Keyring, null = el del usuario
    @ToString.Exclude
    String passphrase;
}
