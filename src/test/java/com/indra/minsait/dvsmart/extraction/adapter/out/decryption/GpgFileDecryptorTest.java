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
package com.indra.minsait.dvsmart.extraction.adapter.out.decryption;

import com.indra.minsait.dvsmart.extraction.domain.exception.DecryptionFailedException;
import com.indra.minsait.dvsmart.extraction.domain.model.DecryptedFile;
import com.indra.minsait.dvsmart.extraction.domain.model.DecryptionSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GpgFileDecryptorTest {

    // Sustituto de gpg: copia --decrypt en --output y guarda la passphrase recibida por stdin
    private static final String COPYING_GPG = String.join("\n",
            "#!/bin/sh",
            "out=''",
            "in=''",
            "pass=0",
            "while [ $# -gt 0 ]; do",
            "  case \"$1\" in",
            "    --output) out=\"$2\"; shift 2 ;;",
            "    --decrypt) in=\"$2\"; shift 2 ;;",
            "    --passphrase-fd) pass=1; shift 2 ;;",
            "    --homedir|--try-secret-key|--pinentry-mode) shift 2 ;;",
            "    *) shift ;;",
            "  esac",
            "done",
            "if [ \"$pass\" = 1 ]; then",
            "  read -r line",
            "  printf '%s' \"$line\" > \"$(dirname \"$0\")/passphrase.seen\"",
            "fi",
            "cp \"$in\" \"$out\"",
            "");

    private static final String FAILING_GPG = String.join("\n",
            "#!/bin/sh",
            "echo 'gpg: decryption failed: No secret key'",
            "exit 2",
            "");

    // Escribe la salida y después falla, como gpg ante un mensaje manipulado
    private static final String PARTIAL_OUTPUT_GPG = String.join("\n",
            "#!/bin/sh",
            "out=''",
            "while [ $# -gt 0 ]; do",
            "  case \"$1\" in",
            "    --output) out=\"$2\"; shift 2 ;;",
            "    *) shift ;;",
            "  esac",
            "done",
            "printf 'id\\n1\\nGARBAGE' > \"$out\"",
            "echo 'gpg: WARNING: encrypted message has been manipulated!'",
            "exit 2",
            "");

    @TempDir
    Path tempDir;

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void decryptsIntoTempFileNamedAfterSource() throws IOException {
        Path gpg = script("gpg-copy.sh", COPYING_GPG);
        GpgFileDecryptor decryptor = new GpgFileDecryptor(gpg.toString());
        DecryptionSettings settings = DecryptionSettings.builder()
                .key("ops@example.com")
                .passphrase("s3cret")
                .build();

        DecryptedFile decrypted = decryptor.decrypt(utf8("id\n1\n"), "secure/orders.csv.gz.gpg", settings);
        try {
            assertEquals("orders.csv.gz", decrypted.getPath().getFileName().toString());
            assertEquals("id\n1\n", new String(decrypted.getStream().readAllBytes(), StandardCharsets.UTF_8));
            assertEquals("s3cret", Files.readString(tempDir.resolve("passphrase.seen")));
        } finally {
            decrypted.close();
        }

        assertFalse(Files.exists(decrypted.getPath()));
        assertFalse(Files.exists(decrypted.getWorkDirectory()));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void missingOutputMeansDecryptionFailed() throws IOException {
        Path gpg = script("gpg-fail.sh", FAILING_GPG);
        GpgFileDecryptor decryptor = new GpgFileDecryptor(gpg.toString());
        DecryptionSettings settings = DecryptionSettings.builder().key("ops@example.com").build();
        InputStream encrypted = utf8("garbage");

        DecryptionFailedException ex = assertThrows(DecryptionFailedException.class,
                () -> decryptor.decrypt(encrypted, "secure/orders.csv.gpg", settings));

        assertEquals("gpg exited with code 2 (gpg: decryption failed: No secret key): secure/orders.csv.gpg",
                ex.getMessage());
        assertEquals("secure/orders.csv.gpg", ex.getSourcePath());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void outputLeftByFailedRunIsDiscarded() throws IOException {
        Path gpg = script("gpg-partial.sh", PARTIAL_OUTPUT_GPG);
        GpgFileDecryptor decryptor = new GpgFileDecryptor(gpg.toString());
        DecryptionSettings settings = DecryptionSettings.builder().key("ops@example.com").build();
        InputStream encrypted = utf8("tampered");

        DecryptionFailedException ex = assertThrows(DecryptionFailedException.class,
                () -> decryptor.decrypt(encrypted, "secure/orders.csv.gpg", settings));

        assertTrue(ex.getMessage().startsWith("gpg exited with code 2"));
        assertTrue(ex.getMessage().contains("has been manipulated"));
        assertEquals("secure/orders.csv.gpg", ex.getSourcePath());
    }

    @Test
    void unavailableExecutableIsReportedAsDecryptionFailure() {
        GpgFileDecryptor decryptor = new GpgFileDecryptor(tempDir.resolve("no-such-gpg").toString());
        DecryptionSettings settings = DecryptionSettings.builder().key("ops@example.com").build();
        InputStream encrypted = utf8("garbage");

        DecryptionFailedException ex = assertThrows(DecryptionFailedException.class,
                () -> decryptor.decrypt(encrypted, "secure/orders.csv.gpg", settings));

        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    void commandUsesBatchModeAndPassesOptionsAsSeparateArguments() {
        GpgFileDecryptor decryptor = new GpgFileDecryptor("gpg");
        DecryptionSettings settings = DecryptionSettings.builder()
                .key("ops key; rm -rf /")
                .gnupgHome("/etc/keys")
                .passphrase("never-on-command-line")
                .build();

        List<String> command = decryptor.buildCommand(settings, Path.of("/tmp/in.tmp"), Path.of("/tmp/out.csv"));

        assertEquals(List.of(
                "gpg", "--batch", "--yes", "--always-trust",
                "--homedir", "/etc/keys",
                "--try-secret-key", "ops key; rm -rf /",
                "--pinentry-mode", "loopback", "--passphrase-fd", "0",
                "--output", "/tmp/out.csv",
                "--decrypt", "/tmp/in.tmp"), command);
        assertFalse(command.contains("never-on-command-line"));
    }

    @Test
    void commandOmitsUnsetOptions() {
        GpgFileDecryptor decryptor = new GpgFileDecryptor("gpg");

        List<String> command = decryptor.buildCommand(
                DecryptionSettings.builder().build(), Path.of("in"), Path.of("out"));

        assertEquals(List.of("gpg", "--batch", "--yes", "--always-trust", "--output", "out", "--decrypt", "in"), command);
    }

    @Test
    void decryptedNameDropsEncryptionSuffix() {
        assertEquals("orders.csv", GpgFileDecryptor.decryptedFileName("a/b/orders.csv.gpg"));
        assertEquals("orders.csv.gz", GpgFileDecryptor.decryptedFileName("orders.csv.gz.PGP"));
        assertEquals("orders.csv", GpgFileDecryptor.decryptedFileName("orders.csv.asc"));
        assertEquals("orders.csv", GpgFileDecryptor.decryptedFileName("orders.csv"));
        assertEquals("decrypted", GpgFileDecryptor.decryptedFileName("dir/"));
    }

    private Path script(String name, String content) throws IOException {
        Path script = tempDir.resolve(name);
        Files.writeString(script, content);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));
        return script;
    }

    private static InputStream utf8(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
