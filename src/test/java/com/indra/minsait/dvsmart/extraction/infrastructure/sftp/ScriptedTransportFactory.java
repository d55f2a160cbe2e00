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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Factory que devuelve, en orden, los resultados programados por el test.
 */
public class ScriptedTransportFactory implements SftpTransportFactory {

    private final Deque<Object> outcomes = new ArrayDeque<>();
    private final List<Boolean> keyFlags = new ArrayList<>();

    public ScriptedTransportFactory failWith(IOException failure, int times) {
        for (int i = 0; i < times; i++) {
            outcomes.add(failure);
        }
        return this;
    }

    public ScriptedTransportFactory thenReturn(SftpTransport transport) {
        outcomes.add(transport);
        return this;
    }

    public int getAttempts() {
        return keyFlags.size();
    }

    public List<Boolean> getKeyFlags() {
        return keyFlags;
    }

    @Override
    public SftpTransport open(ConnectionSettings settings, boolean useKey) throws IOException {
        keyFlags.add(useKey);
        Object next = outcomes.poll();
        if (next == null) {
            throw new IllegalStateException("No scripted outcome left for attempt " + keyFlags.size());
        }
        if (next instanceof IOException) {
            throw (IOException) next;
        }
        return (SftpTransport) next;
    }
}
