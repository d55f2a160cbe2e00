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

import com.indra.minsait.dvsmart.extraction.application.port.out.FileDecryptor;
import com.indra.minsait.dvsmart.extraction.application.port.out.RemoteDirectoryLister;
import com.indra.minsait.dvsmart.extraction.domain.exception.RemoteDirectoryNotFoundException;
import com.indra.minsait.dvsmart.extraction.domain.exception.RemoteOperationException;
import com.indra.minsait.dvsmart.extraction.domain.exception.SftpConnectionException;
import com.indra.minsait.dvsmart.extraction.domain.model.DecryptedFile;
import com.indra.minsait.dvsmart.extraction.domain.model.DecryptionSettings;
import com.indra.minsait.dvsmart.extraction.domain.model.RemoteFileDescriptor;
import com.indra.minsait.dvsmart.extraction.domain.model.SftpFileEntry;
import com.indra.minsait.dvsmart.extraction.infrastructure.retry.ExponentialBackoff;
import lombok.extern.slf4j.Slf4j;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Optional;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 11-10-2026 at 09:25:40
 * File: SftpConnection.java
 */

/**
 * Conexión SFTP con ciclo de vida explícito.
 *
 * Características:
 * - Lazy: no conecta hasta {@link #ensureConnected()} o la primera operación remota
 * - Reintenta el connect completo si el servidor corta antes del handshake
 * - Si falla la autenticación con clave, prueba una vez solo con password
 * - Mantiene como mucho un fichero descifrado abierto, que se cierra con la conexión
 *
 * No es thread-safe: cada worker debe usar su propia instancia.
 */
@Slf4j
public class SftpConnection implements RemoteDirectoryLister, AutoCloseable {

    private final ConnectionSettings settings;
    private final SftpTransportFactory transportFactory;
    private final ExponentialBackoff backoff;
    private final FileDecryptor decryptor;

    private SftpTransport transport;
    private boolean active;
    private DecryptedFile decryptedFile;

    public SftpConnection(
            ConnectionSettings settings,
            SftpTransportFactory transportFactory,
            ExponentialBackoff backoff,
            FileDecryptor decryptor) {
        this.settings = settings;
        this.transportFactory = transportFactory;
        this.backoff = backoff;
        this.decryptor = decryptor;
    }

    /**
     * Conecta si no hay una sesión activa. Idempotente.
     *
     * @throws SftpConnectionException si el connect falla de forma definitiva
     */
    public void ensureConnected() {
        if (active) {
            if (transport.isOpen()) {
                return;
            }
            log.warn("SFTP session to {}:{} is no longer open, reconnecting", settings.getHost(), settings.getPort());
            releaseTransport();
            active = false;
        }

        String target = settings.getUsername() + "@" + settings.getHost() + ":" + settings.getPort();
        try {
            transport = backoff.execute("SSH connection to " + target, EOFException.class, this::tryConnect);
        } catch (SftpAuthenticationException e) {
            throw new SftpConnectionException("Authentication failed for " + target, e);
        } catch (IOException e) {
            throw new SftpConnectionException("Could not connect to " + target, e);
        }

        active = true;
        log.info("Connected to SFTP server {}", target);
    }

    private SftpTransport tryConnect() throws IOException {
        if (settings.hasPrivateKey()) {
            try {
                return transportFactory.open(settings, true);
            } catch (SftpAuthenticationException e) {
                log.warn("Key authentication failed for {}@{}, falling back to password: {}",
                        settings.getUsername(), settings.getHost(), e.getMessage());
            }
        }
        return transportFactory.open(settings, false);
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public List<SftpFileEntry> listDirectory(String path) {
        ensureConnected();
        try {
            return transport.list(path);
        } catch (NoSuchFileException e) {
            throw new RemoteDirectoryNotFoundException(path, e);
        } catch (IOException e) {
            throw new RemoteOperationException("Failed to list directory", path, e);
        }
    }

    /**
     * Abre el fichero remoto en modo lectura. El llamador debe cerrarlo.
     */
    public InputStream openFile(String path) {
        ensureConnected();
        try {
            return transport.open(path);
        } catch (IOException e) {
            throw new RemoteOperationException("Failed to open file", path, e);
        }
    }

    /**
     * Devuelve el contenido del fichero, descifrado si se indica configuración de descifrado.
     *
     * El flujo descifrado queda asociado a la conexión y se libera en {@link #close()}
     * aunque el llamador no lo cierre.
     */
    public InputStream getFileHandle(RemoteFileDescriptor file, DecryptionSettings decryption) {
        String path = file.getFilepath();
        if (decryption == null) {
            return openFile(path);
        }

        log.info("Decrypting file: {}", path);
        DecryptedFile decrypted;
        try (InputStream encrypted = openFile(path)) {
            decrypted = decryptor.decrypt(encrypted, path, decryption);
        } catch (IOException e) {
            throw new RemoteOperationException("Failed to read encrypted file", path, e);
        }

        releaseDecryptedFile();
        this.decryptedFile = decrypted;
        return decrypted.getStream();
    }

    public Optional<DecryptedFile> getDecryptedFile() {
        return Optional.ofNullable(decryptedFile);
    }

    /**
     * Libera el transporte y el fichero descifrado. Se puede llamar varias veces
     * y sobre una conexión que nunca llegó a abrirse.
     */
    @Override
    public void close() {
        if (active) {
            releaseTransport();
            active = false;
            log.info("SFTP connection to {}:{} closed", settings.getHost(), settings.getPort());
        }
        releaseDecryptedFile();
    }

    private void releaseTransport() {
        if (transport == null) {
            return;
        }
        try {
            transport.close();
        } catch (IOException e) {
            log.warn("Error closing SFTP transport to {}:{}", settings.getHost(), settings.getPort(), e);
        } finally {
            transport = null;
        }
    }

    private void releaseDecryptedFile() {
        if (decryptedFile == null) {
            return;
        }
        try {
            decryptedFile.close();
        } catch (IOException e) {
            log.warn("Error releasing decrypted temp file {}", decryptedFile.getPath(), e);
        } finally {
            decryptedFile = null;
        }
    }
}
