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

import com.indra.minsait.dvsmart.extraction.application.port.out.RemoteDirectoryLister;
import com.indra.minsait.dvsmart.extraction.domain.model.RemoteFileDescriptor;
import com.indra.minsait.dvsmart.extraction.domain.model.SftpFileEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 08-10-2026 at 09:41:52
 * File: FileDiscoveryService.java
 */

/**
 * Descubrimiento recursivo de ficheros remotos con filtrado por patrón y fecha.
 *
 * Reglas:
 * - Prefijo vacío o nulo equivale a "."
 * - Los directorios se recorren en profundidad hasta {@code maxDepth}
 * - Se descartan directorios y ficheros de 0 bytes (un tamaño desconocido no cuenta como 0)
 * - Sin mtime se usa la hora actual (warning, no error)
 * - El patrón se busca dentro de la ruta (no tiene que cubrirla entera)
 * - modifiedSince es cota inferior exclusiva
 */
@Slf4j
@Service
public class FileDiscoveryService {

    public static final int DEFAULT_MAX_DEPTH = 64;

    private final int maxDepth;
    private final Clock clock;

    @Autowired
    public FileDiscoveryService(@Value("${sftp.discovery.max-depth:64}") int maxDepth) {
        this(maxDepth, Clock.systemUTC());
    }

    public FileDiscoveryService(int maxDepth, Clock clock) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.clock = clock;
    }

    /**
     * Lista, filtra por patrón y, si se indica, por fecha de modificación.
     */
    public List<RemoteFileDescriptor> getFiles(
            RemoteDirectoryLister lister,
            String prefix,
            String searchPattern,
            Instant modifiedSince) {

        List<RemoteFileDescriptor> files = getFilesByPrefix(lister, prefix);
        if (files.isEmpty()) {
            log.warn("Found no files on specified SFTP server at \"{}\"", prefix);
        } else {
            log.info("Found {} files in \"{}\"", files.size(), prefix);
        }

        List<RemoteFileDescriptor> matching = getFilesMatchingPattern(files, searchPattern);
        if (matching.isEmpty()) {
            log.warn("Found no files on specified SFTP server at \"{}\" matching \"{}\"", prefix, searchPattern);
        } else {
            log.info("Found {} files in \"{}\" matching \"{}\"", matching.size(), prefix, searchPattern);
        }
        for (RemoteFileDescriptor file : matching) {
            log.info("Found file: {}", file.getFilepath());
        }

        if (modifiedSince == null) {
            return matching;
        }

        List<RemoteFileDescriptor> modified = new ArrayList<>();
        for (RemoteFileDescriptor file : matching) {
            if (file.getLastModified().isAfter(modifiedSince)) {
                modified.add(file);
            }
        }
        log.debug("{} of {} matching files modified after {}", modified.size(), matching.size(), modifiedSince);
        return modified;
    }

    /**
     * Variante por tabla: solo añade el nombre de la tabla al log.
     */
    public List<RemoteFileDescriptor> getFilesForTable(
            RemoteDirectoryLister lister,
            String tableName,
            String prefix,
            String searchPattern,
            Instant modifiedSince) {

        log.info("Searching for files for table '{}', matching pattern: {}", tableName, searchPattern);
        return getFiles(lister, prefix, searchPattern, modifiedSince);
    }

    /**
     * Recorre recursivamente {@code prefix} y devuelve todos los ficheros no vacíos.
     */
    public List<RemoteFileDescriptor> getFilesByPrefix(RemoteDirectoryLister lister, String prefix) {
        String root = (prefix == null || prefix.isEmpty()) ? "." : prefix;
        List<RemoteFileDescriptor> files = new ArrayList<>();
        collect(lister, root, 0, files);
        return files;
    }

    public List<RemoteFileDescriptor> getFilesMatchingPattern(List<RemoteFileDescriptor> files, String pattern) {
        log.info("Searching for files for matching pattern: {}", pattern);
        Pattern matcher = Pattern.compile(pattern);
        List<RemoteFileDescriptor> matching = new ArrayList<>();
        for (RemoteFileDescriptor file : files) {
            Matcher m = matcher.matcher(file.getFilepath());
            if (m.find()) {
                matching.add(file);
            }
        }
        return matching;
    }

    private void collect(RemoteDirectoryLister lister, String directory, int depth, List<RemoteFileDescriptor> files) {
        log.debug("Scanning directory: {}", directory);

        for (SftpFileEntry entry : lister.listDirectory(directory)) {
            String fullPath = join(directory, entry.getFilename());

            if (entry.isDirectory()) {
                if (depth >= maxDepth) {
                    log.warn("Skipping directory {}: maximum traversal depth {} reached", fullPath, maxDepth);
                    continue;
                }
                collect(lister, fullPath, depth + 1, files);
                continue;
            }

            if (entry.getSize() != null && entry.getSize() == 0L) {
                log.trace("Skipping empty file: {}", fullPath);
                continue;
            }

            files.add(RemoteFileDescriptor.builder()
                    .filepath(fullPath)
                    .lastModified(lastModified(entry, fullPath))
                    .build());
        }
    }

    private Instant lastModified(SftpFileEntry entry, String fullPath) {
        if (entry.getModificationTime() == null) {
            log.warn("Cannot read m_time for file {}, defaulting to current epoch time", fullPath);
            return clock.instant();
        }
        return Instant.ofEpochSecond(entry.getModificationTime());
    }

    // SFTP siempre separa con '/', independientemente del SO del servidor
    private static String join(String directory, String name) {
        return directory.endsWith("/") ? directory + name : directory + "/" + name;
    }
}
