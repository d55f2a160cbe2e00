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
package com.indra.minsait.dvsmart.extraction.application.port.in;

import com.indra.minsait.dvsmart.extraction.application.port.out.RecordSink;
import com.indra.minsait.dvsmart.extraction.domain.model.ExtractionResult;
import com.indra.minsait.dvsmart.extraction.domain.model.TableExtractionRequest;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 09-10-2026 at 10:55:09
 * File: ExtractTableUseCase.java
 */
public interface ExtractTableUseCase {

    ExtractionResult execute(TableExtractionRequest request, RecordSink sink);
}
