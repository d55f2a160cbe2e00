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

import com.indra.minsait.dvsmart.extraction.domain.exception.RemoteDirectoryNotFoundException;
import com.indra.minsait.dvsmart.extraction.domain.exception.SftpConnectionException;
import com.indra.minsait.dvsmart.extraction.domain.model.RemoteFileDescriptor;
import com.indra.minsait.dvsmart.extraction.domain.model.SftpFileEntry;
import com.indra.minsait.dvsmart.extraction.domain.service.FileDiscoveryService;
import com.indra.minsait.dvsmart.extraction.infrastructure.retry.ExponentialBackoff;
import org.apache.sshd.common.file.virtualfs.VirtualFileSystemFactory;
import org.apache.sshd.server.SshServer;
import org.apache.sshd.server.keyprovider.SimpleGeneratorHostKeyProvider;
import org.apache.sshd.sftp.server.SftpSubsystemFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contra un servidor SFTP embebido en el propio test.
 */
class SshdSftpTransportFactoryTest {

    private static final String USER = "extraction";
    private static final String PASSWORD = "secret";

    @TempDir
    Path tempDir;

    private SshServer server;
    private Path root;
    private final SshdSftpTransportFactory factory = new SshdSftpTransportFactory();

    @BeforeEach
    void startServer() throws IOException {
        root = Files.createDirectories(tempDir.resolve("home"));

        server = SshServer.setUpDefaultServer();
        server.setHost("127.0.0.1");
        server.setPort(0);
        server.setKeyPairProvider(new SimpleGeneratorHostKeyProvider(tempDir.resolve("hostkey.ser")));
        server.setPasswordAuthenticator((username, password, session) -> USER.equals(username) && PASSWORD.equals(password));
        server.setSubsystemFactories(Collections.singletonList(new SftpSubsystemFactory()));
        server.setFileSystemFactory(new VirtualFileSystemFactory(root));
        server.start();
    }

    @AfterEach
    void stopServer() throws IOException {
        if (server != null) {
            server.stop(true);
        }
    }

    private ConnectionSettings settings(String password) {
        return ConnectionSettings.builder()
                .host("127.0.0.1")
                .port(server.getPort())
                .username(USER)
                .password(password)
                .timeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .build();
    }

    private Path remoteFile(String relative, String content, long epochSeconds) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        Files.setLastModifiedTime(file, FileTime.from(Instant.ofEpochSecond(epochSeconds)));
        return file;
    }

    @Test
    void listsDirectoryWithSizesAndModificationTimes() throws IOException {
        remoteFile("exports/a.csv", "id\n1\n", 1_700_000_000L);
        Files.createDirectories(root.resolve("exports/daily"));

        try (SftpTransport transport = factory.open(settings(PASSWORD), false)) {
            List<SftpFileEntry> entries = transport.list("exports");
            entries.sort(Comparator.comparing(SftpFileEntry::getFilename));

            assertEquals(2, entries.size());
            SftpFileEntry file = entries.get(0);
            assertEquals("a.csv", file.getFilename());
            assertEquals(5L, file.getSize());
            assertEquals(1_700_000_000L, file.getModificationTime());
            assertFalse(file.isDirectory());

            assertEquals("daily", entries.get(1).getFilename());
            assertTrue(entries.get(1).isDirectory());
        }
    }

    @Test
    void missingDirectoryIsNoSuchFile() throws IOException {
        try (SftpTransport transport = factory.open(settings(PASSWORD), false)) {
            assertThrows(NoSuchFileException.class, () -> transport.list("does-not-exist"));
        }
    }

    @Test
    void opensFileForReading() throws IOException {
        remoteFile("exports/a.csv", "id,name\n1,ana\n", 1L);

        try (SftpTransport transport = factory.open(settings(PASSWORD), false);
             InputStream in = transport.open("exports/a.csv")) {
            assertEquals("id,name\n1,ana\n", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void wrongPasswordIsAuthenticationFailure() {
        assertThrows(SftpAuthenticationException.class, () -> factory.open(settings("wrong"), false));
    }

    @Test
    void closedTransportIsNoLongerOpen() throws IOException {
        SftpTransport transport = factory.open(settings(PASSWORD), false);
        assertTrue(transport.isOpen());

        transport.close();

        assertFalse(transport.isOpen());
    }

    @Test
    void discoversFilesThroughConnection() throws IOException {
        remoteFile("root/a.csv", "id\n1\n", 1_000L);
        remoteFile("root/sub/b.csv", "id\n2\n", 2_000L);
        remoteFile("root/sub/empty.csv", "", 3_000L);

        ExponentialBackoff backoff = new ExponentialBackoff(1, Duration.ofMillis(1), 2.0, delay -> { });
        FileDiscoveryService discovery = new FileDiscoveryService(FileDiscoveryService.DEFAULT_MAX_DEPTH,
                Clock.systemUTC());

        try (SftpConnection connection = new SftpConnection(settings(PASSWORD), factory, backoff, null)) {
            List<String> paths = discovery.getFiles(connection, "root", "\\.csv$", null).stream()
                    .map(RemoteFileDescriptor::getFilepath)
                    .sorted()
                    .collect(Collectors.toList());

            assertEquals(List.of("root/a.csv", "root/sub/b.csv"), paths);
            assertThrows(RemoteDirectoryNotFoundException.class, () -> connection.listDirectory("elsewhere"));
        }
    }

    @Test
    void unreachableServerIsConnectionFailure() throws IOException {
        ConnectionSettings settings = settings(PASSWORD);
        server.stop(true);
        server = null;

        ExponentialBackoff backoff = new ExponentialBackoff(1, Duration.ofMillis(1), 2.0, delay -> { });
        try (SftpConnection connection = new SftpConnection(settings, factory, backoff, null)) {
            assertThrows(SftpConnectionException.class, connection::ensureConnected);
        }
    }
}
