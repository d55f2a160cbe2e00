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

import lombok.extern.slf4j.Slf4j;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.NamedFactory;
import org.apache.sshd.common.compression.BuiltinCompressions;
import org.apache.sshd.common.compression.Compression;
import org.apache.sshd.common.keyprovider.FileKeyPairProvider;
import org.apache.sshd.common.keyprovider.KeyIdentityProvider;
import org.apache.sshd.core.CoreModuleProperties;
import org.apache.sshd.sftp.client.SftpClient;
import org.apache.sshd.sftp.client.SftpClientFactory;
import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 10-10-2026 at 10:34:15
 * File: SshdSftpTransportFactory.java
 */

/**
 * Crea transportes SFTP sobre Apache MINA SSHD.
 *
 * Cada transporte tiene su propio SshClient, de modo que dos conexiones no comparten
 * estado mutable. La compresión zlib se ofrece con preferencia y "none" como
 * respaldo si el servidor no la soporta.
 */
@Slf4j
public class SshdSftpTransportFactory implements SftpTransportFactory {

    @Override
    public SftpTransport open(ConnectionSettings settings, boolean useKey) throws IOException {
        log.debug("Opening SFTP transport to {}:{} (key={})", settings.getHost(), settings.getPort(), useKey);

        SshClient client = createClient(settings);
        client.start();

        ClientSession session = null;
        try {
            session = connect(client, settings);
            authenticate(session, settings, useKey);
            SftpClient sftp = SftpClientFactory.instance().createSftpClient(session);

            log.debug("SFTP channel opened: {}:{}", settings.getHost(), settings.getPort());
            return new SshdSftpTransport(client, session, sftp);

        } catch (IOException | RuntimeException e) {
            release(client, session);
            throw e;
        }
    }

    private SshClient createClient(ConnectionSettings settings) {
        SshClient client = SshClient.setUpDefaultClient();

        // Equivalente a allowUnknownKeys: no se verifica la clave del host
        client.setServerKeyVerifier(AcceptAllServerKeyVerifier.INSTANCE);
        client.setKeyIdentityProvider(KeyIdentityProvider.EMPTY_KEYS_PROVIDER);

        List<NamedFactory<Compression>> compressions = new ArrayList<>();
        compressions.add(BuiltinCompressions.delayedZlib);
        compressions.add(BuiltinCompressions.zlib);
        compressions.add(BuiltinCompressions.none);
        client.setCompressionFactories(compressions);

        if (!settings.getReadTimeout().isZero()) {
            CoreModuleProperties.NIO2_READ_TIMEOUT.set(client, settings.getReadTimeout());
        }
        return client;
    }

    private ClientSession connect(SshClient client, ConnectionSettings settings) throws IOException {
        try {
            return client.connect(settings.getUsername(), settings.getHost(), settings.getPort())
                    .verify(settings.getTimeout().toMillis())
                    .getSession();
        } catch (IOException e) {
            throw asHandshakeDropIfApplicable(e, settings);
        }
    }

    private void authenticate(ClientSession session, ConnectionSettings settings, boolean useKey) throws IOException {
        if (useKey && settings.hasPrivateKey()) {
            session.setKeyIdentityProvider(new FileKeyPairProvider(settings.getPrivateKeyFile()));
        } else if (settings.getPassword() != null) {
            session.addPasswordIdentity(settings.getPassword());
        }

        try {
            session.auth().verify(settings.getTimeout().toMillis());
        } catch (IOException e) {
            IOException classified = asHandshakeDropIfApplicable(e, settings);
            if (classified instanceof EOFException) {
                throw classified;
            }
            throw new SftpAuthenticationException(
                    "Authentication failed for " + settings.getUsername() + "@" + settings.getHost()
                            + (useKey ? " using private key" : " using password"), e);
        }
    }

    /**
     * Un EOF en cualquier punto de la cadena de causas indica que el servidor cortó
     * la conexión antes de terminar el handshake.
     */
    static IOException asHandshakeDropIfApplicable(IOException e, ConnectionSettings settings) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof EOFException) {
                EOFException eof = new EOFException("Connection to " + settings.getHost() + ":" + settings.getPort()
                        + " closed before handshake completed");
                eof.initCause(e);
                return eof;
            }
        }
        return e;
    }

    private void release(SshClient client, ClientSession session) {
        if (session != null) {
            try {
                session.close();
            } catch (IOException e) {
                log.warn("Error closing SSH session after failed connect", e);
            }
        }
        client.stop();
    }
}
