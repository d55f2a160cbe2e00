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
import lombok.extern.slf4j.Slf4j;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.sftp.client.SftpClient;
import org.apache.sshd.sftp.common.SftpConstants;
import org.apache.sshd.sftp.common.SftpException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 10-10-2026 at 11:02:48
 * File: SshdSftpTransport.java
 */

/**
 * Transporte SFTP sobre una ClientSession de SSHD ya autenticada.
 */
@Slf4j
class SshdSftpTransport implements SftpTransport {

    private final SshClient client;
    private final ClientSession session;
    private final SftpClient sftp;

    SshdSftpTransport(SshClient client, ClientSession session, SftpClient sftp) {
        this.client = client;
        this.session = session;
        this.sftp = sftp;
    }

    @Override
    public List<SftpFileEntry> list(String path) throws IOException {
        List<SftpFileEntry> entries = new ArrayList<>();

        try (SftpClient.CloseableHandle handle = sftp.openDir(path)) {
            List<SftpClient.DirEntry> batch;
            while ((batch = sftp.readDir(handle)) != null) {
                for (SftpClient.DirEntry entry : batch) {
                    String name = entry.getFilename();
                    if (".".equals(name) || "..".equals(name)) {
                        continue;
                    }
                    entries.add(toEntry(name, entry.getAttributes()));
                }
            }
        } catch (SftpException e) {
            throw notFoundOrSame(e, path);
        }

        log.trace("Listed {} entries in {}", entries.size(), path);
        return entries;
    }

    @Override
    public InputStream open(String path) throws IOException {
        try {
            return sftp.read(path);
        } catch (SftpException e) {
            throw notFoundOrSame(e, path);
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen() && sftp.isOpen();
    }

    @Override
    public void close() throws IOException {
        try {
            sftp.close();
        } finally {
            try {
                session.close();
            } finally {
                client.stop();
            }
        }
    }

    /**
     * Los atributos que el servidor no envía quedan a null: un tamaño ausente no es un fichero vacío.
     */
    static SftpFileEntry toEntry(String filename, SftpClient.Attributes attrs) {
        Set<SftpClient.Attribute> flags = attrs.getFlags();
        FileTime mtime = flags.contains(SftpClient.Attribute.ModifyTime) ? attrs.getModifyTime() : null;

        return SftpFileEntry.builder()
                .filename(filename)
                .size(flags.contains(SftpClient.Attribute.Size) ? Long.valueOf(attrs.getSize()) : null)
                .modificationTime(mtime == null ? null : mtime.to(TimeUnit.SECONDS))
                .directory(attrs.isDirectory())
                .build();
    }

    private static IOException notFoundOrSame(SftpException e, String path) {
        int status = e.getStatus();
        if (status == SftpConstants.SSH_FX_NO_SUCH_FILE || status == SftpConstants.SSH_FX_NO_SUCH_PATH) {
            NoSuchFileException notFound = new NoSuchFileException(path);
            notFound.initCause(e);
            return notFound;
        }
        return e;
    }
}
