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
package com.indra.minsait.dvsmart.extraction.domain.service;

import org.junit.jupiter.api.Test;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeaderSanitizerTest {

    @Test
    void replacesRunsOfInvalidCharactersWithSingleUnderscore() {
        assertEquals("order_id", HeaderSanitizer.sanitize("Order ID"));
        assertEquals("unit_price_eur_", HeaderSanitizer.sanitize("Unit Price (EUR)"));
        assertEquals("a_b", HeaderSanitizer.sanitize("a -- b"));
    }

    @Test
    void prefixesLeadingDigits() {
        assertEquals("x_2024_total", HeaderSanitizer.sanitize("2024 total"));
        assertEquals("x_9", HeaderSanitizer.sanitize("9"));
    }

    @Test
    void keepsAlreadyValidNamesApartFromCase() {
        assertEquals("customer_name", HeaderSanitizer.sanitize("Customer_Name"));
        assertEquals("id", HeaderSanitizer.sanitize("id"));
    }

    @Test
    void sanitizingTwiceGivesSameResult() {
        for (String raw : List.of("Order ID", "2024 total", "Unit Price (EUR)", "ÁREA", "already_ok")) {
            String once = HeaderSanitizer.sanitize(raw);
            assertEquals(once, HeaderSanitizer.sanitize(once), raw);
        }
    }

    @Test
    void sanitizeAllKeepsOrder() {
        assertEquals(List.of("id", "first_name", "x_1st"),
                HeaderSanitizer.sanitizeAll(List.of("ID", "First Name", "1st")));
    }
}
