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
import java.time.Instant;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 05-10-2026 at 10:20:03
 * File: RemoteFileDescriptor.java
 */

/**
 * Archivo remoto descubierto: ruta separada por '/' y fecha de modificación en UTC.
 */
@Value
@Builder
public class RemoteFileDescriptor {
    String filepath;
    Instant lastModified;
}
