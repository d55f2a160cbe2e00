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
package com.indra.minsait.dvsmart.extraction.adapter.out.compression;

import com.indra.minsait.dvsmart.extraction.domain.exception.UnsupportedCompressionException;
import com.indra.minsait.dvsmart.extraction.domain.model.NamedStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.input.CloseShieldInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 07-10-2026 at 16:20:54
 * File: DecompressionStage.java
 */

/**
 * Decide por la extensión si el flujo está comprimido y devuelve sus miembros.
 *
 * <ul>
 *   <li>.tar.gz / .tgz: no soportado</li>
 *   <li>.gz: un único miembro</li>
 *   <li>.zip: un miembro por entrada (sin directorios), en orden, bajo demanda</li>
 *   <li>cualquier otro: el propio flujo</li>
 * </ul>
 */
@Slf4j
public class DecompressionStage {

    public Iterator<NamedStream> expand(InputStream in, String fileName) throws IOException {
        if (fileName == null) {
            return Collections.singletonList(new NamedStream(null, in)).iterator();
        }

        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".tar.gz") || lower.endsWith(".tgz")) {
            throw new UnsupportedCompressionException(fileName);
        }
        if (lower.endsWith(".gz")) {
            log.debug("Inflating gzip file {}", fileName);
            String name = fileName.substring(0, fileName.length() - ".gz".length());
            return Collections.singletonList(new NamedStream(name, new GZIPInputStream(in))).iterator();
        }
        if (lower.endsWith(".zip")) {
            log.debug("Expanding zip archive {}", fileName);
            return new ZipEntryIterator(new ZipInputStream(in));
        }
        return Collections.singletonList(new NamedStream(fileName, in)).iterator();
    }

    /**
     * Cada miembro se lee directamente del ZipInputStream; cerrar el flujo de un
     * miembro no debe cerrar el archivo.
     */
    private static final class ZipEntryIterator implements Iterator<NamedStream> {

        private final ZipInputStream zip;
        private ZipEntry next;
        private boolean fetched;

        ZipEntryIterator(ZipInputStream zip) {
            this.zip = zip;
        }

        @Override
        public boolean hasNext() {
            if (!fetched) {
                next = advance();
                fetched = true;
            }
            return next != null;
        }

        @Override
        public NamedStream next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            fetched = false;
            return new NamedStream(next.getName(), CloseShieldInputStream.wrap(zip));
        }

        private ZipEntry advance() {
            try {
                ZipEntry entry = zip.getNextEntry();
                while (entry != null && entry.isDirectory()) {
                    entry = zip.getNextEntry();
                }
                return entry;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read zip archive", e);
            }
        }
    }
}
