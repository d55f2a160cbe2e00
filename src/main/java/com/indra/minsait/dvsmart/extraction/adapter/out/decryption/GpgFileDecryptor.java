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

import com.indra.minsait.dvsmart.extraction.application.port.out.FileDecryptor;
import com.indra.minsait.dvsmart.extraction.domain.exception.DecryptionFailedException;
import com.indra.minsait.dvsmart.extraction.domain.model.DecryptedFile;
import com.indra.minsait.dvsmart.extraction.domain.model.DecryptionSettings;
import lombok.extern.slf4j.Slf4j;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 07-10-2026 at 13:08:26
 * File: GpgFileDecryptor.java
 */

/**
 * Descifrado mediante el ejecutable gpg.
 *
 * Flujo:
 * 1. Copia el flujo cifrado a un directorio temporal exclusivo de la llamada
 * 2. Lanza gpg en modo batch escribiendo el resultado en el mismo directorio
 * 3. Éxito solo si gpg termina con código 0 y deja el fichero de salida
 *
 * Los argumentos se pasan por separado a ProcessBuilder, sin shell intermedio.
 * La passphrase viaja por stdin (--passphrase-fd 0), nunca en la línea de comandos.
 */
@Slf4j
public class GpgFileDecryptor implements FileDecryptor {

    private static final String[] ENCRYPTED_SUFFIXES = {".gpg", ".pgp", ".asc"};

    private final String gpgExecutable;

    public GpgFileDecryptor(String gpgExecutable) {
        this.gpgExecutable = gpgExecutable;
    }

    @Override
    public DecryptedFile decrypt(InputStream encrypted, String sourcePath, DecryptionSettings settings) throws IOException {
        Path workDir = Files.createTempDirectory("sftp-decrypt-");
        Path encryptedCopy = Files.createTempFile(workDir, "encrypted-", ".tmp");
        Path output = workDir.resolve(decryptedFileName(sourcePath));

        GpgOutcome outcome = null;
        boolean decrypted = false;
        try {
            Files.copy(encrypted, encryptedCopy, StandardCopyOption.REPLACE_EXISTING);
            outcome = run(buildCommand(settings, encryptedCopy, output), settings.getPassphrase(), sourcePath);
            // Con exit distinto de 0 la salida puede existir y estar incompleta o manipulada
            decrypted = outcome.exitCode == 0 && Files.exists(output);
        } finally {
            Files.deleteIfExists(encryptedCopy);
            if (!decrypted) {
                Files.deleteIfExists(output);
                Files.deleteIfExists(workDir);
            }
        }

        if (outcome.exitCode != 0) {
            throw new DecryptionFailedException(
                    "gpg exited with code " + outcome.exitCode + " (" + outcome.output + ")", sourcePath);
        }
        if (!decrypted) {
            throw new DecryptionFailedException(sourcePath);
        }

        log.debug("Decrypted {} to {}", sourcePath, output);
        return DecryptedFile.open(output, workDir);
    }

    List<String> buildCommand(DecryptionSettings settings, Path input, Path output) {
        List<String> command = new ArrayList<>();
        command.add(gpgExecutable);
        command.add("--batch");
        command.add("--yes");
        command.add("--always-trust");
        if (settings.getGnupgHome() != null && !settings.getGnupgHome().isBlank()) {
            command.add("--homedir");
            command.add(settings.getGnupgHome());
        }
        if (settings.getKey() != null && !settings.getKey().isBlank()) {
            command.add("--try-secret-key");
            command.add(settings.getKey());
        }
        if (settings.getPassphrase() != null) {
            command.add("--pinentry-mode");
            command.add("loopback");
            command.add("--passphrase-fd");
            command.add("0");
        }
        command.add("--output");
        command.add(output.toString());
        command.add("--decrypt");
        command.add(input.toString());
        return command;
    }

    private GpgOutcome run(List<String> command, String passphrase, String sourcePath) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new DecryptionFailedException("Could not run '" + gpgExecutable + "' to decrypt file", sourcePath, e);
        }

        try (OutputStream stdin = process.getOutputStream()) {
            if (passphrase != null) {
                stdin.write((passphrase + "\n").getBytes(StandardCharsets.UTF_8));
            }
        }

        String toolOutput;
        try (InputStream stdout = process.getInputStream()) {
            toolOutput = new String(stdout.readAllBytes(), StandardCharsets.UTF_8).trim();
        }

        int exit;
        try {
            exit = process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while decrypting " + sourcePath);
            interrupted.initCause(e);
            throw interrupted;
        }

        if (exit != 0) {
            log.warn("gpg exited with code {} for {}: {}", exit, sourcePath, toolOutput);
        } else if (!toolOutput.isEmpty()) {
            log.debug("gpg output for {}: {}", sourcePath, toolOutput);
        }
        return new GpgOutcome(exit, toolOutput);
    }

    /**
     * Nombre base del fichero remoto sin la extensión de cifrado.
     */
    static String decryptedFileName(String sourcePath) {
        String name = sourcePath.substring(sourcePath.lastIndexOf('/') + 1);
        String lower = name.toLowerCase(Locale.ROOT);
        for (String suffix : ENCRYPTED_SUFFIXES) {
            if (lower.endsWith(suffix) && name.length() > suffix.length()) {
                return name.substring(0, name.length() - suffix.length());
            }
        }
        return name.isEmpty() ? "decrypted" : name;
    }

    private static final class GpgOutcome {
        private final int exitCode;
        private final String output;

        private GpgOutcome(int exitCode, String output) {
            this.exitCode = exitCode;
            this.output = output;
        }
    }
}
