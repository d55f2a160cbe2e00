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

import com.indra.minsait.dvsmart.extraction.domain.model.SftpFileEntry;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Transporte en memoria: directorios y ficheros declarados explícitamente.
 */
public class InMemorySftpTransport implements SftpTransport {

    private final Map<String, List<SftpFileEntry>> directories = new HashMap<>();
    private final Map<String, byte[]> files = new HashMap<>();
    private final List<String> listedPaths = new ArrayList<>();
    private boolean open = true;
    private int closeCount;

    public InMemorySftpTransport directory(String path, SftpFileEntry... entries) {
        directories.put(path, new ArrayList<>(Arrays.asList(entries)));
        return this;
    }

    public InMemorySftpTransport file(String path, byte[] content) {
        files.put(path, content);
        return this;
    }

    public InMemorySftpTransport file(String path, String content) {
        return file(path, content.getBytes(StandardCharsets.UTF_8));
    }

    public static SftpFileEntry fileEntry(String name, long size, Long mtime) {
        return SftpFileEntry.builder().filename(name).size(size).modificationTime(mtime).directory(false).build();
    }

    public static SftpFileEntry dirEntry(String name) {
        return SftpFileEntry.builder().filename(name).size(4096L).modificationTime(0L).directory(true).build();
    }

    /** Simula que el servidor cierra la sesión. */
    public void drop() {
        open = false;
    }

    public int getCloseCount() {
        return closeCount;
    }

    public List<String> getListedPaths() {
        return listedPaths;
    }

    @Override
    public List<SftpFileEntry> list(String path) throws IOException {
        listedPaths.add(path);
        List<SftpFileEntry> entries = directories.get(path);
        if (entries == null) {
            throw new NoSuchFileException(path);
        }
        return new ArrayList<>(entries);
    }

    @Override
    public InputStream open(String path) throws IOException {
        byte[] content = files.get(path);
        if (content == null) {
            throw new NoSuchFileException(path);
        }
        return new ByteArrayInputStream(content);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        closeCount++;
    }
}
