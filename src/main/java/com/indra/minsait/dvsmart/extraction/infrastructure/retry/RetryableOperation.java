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
package com.indra.minsait.dvsmart.extraction.infrastructure.retry;

import java.io.IOException;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 10-10-2026 at 09:14:48
 * File: RetryableOperation.java
 */
@FunctionalInterface
public interface RetryableOperation<T> {

    T call() throws IOException;
}
