package dev.mars.devicedb.device.registry;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


import dev.mars.devicedb.api.database.DatabaseType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Naming of backup files: {@code <LogicalName>_<yyyyMMdd_HHmmss_SSS>.db}, with a
 * {@code _<n>} sequence before the extension when that name is already taken.
 * The newest backup has the greatest timestamp, then the greatest sequence.
 */
public final class BackupFiles {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final String EXTENSION = ".db";

    private BackupFiles() {
    }

    public static String backupFileName(DatabaseType type, LocalDateTime timestamp) {
        return type.logicalName() + "_" + TIMESTAMP.format(timestamp) + EXTENSION;
    }

    /**
     * First backup path for {@code timestamp} in {@code directory} that does not exist yet.
     */
    public static Path nextBackupFile(Path directory, DatabaseType type, LocalDateTime timestamp) {
        String base = type.logicalName() + "_" + TIMESTAMP.format(timestamp);
        Path candidate = directory.resolve(base + EXTENSION);
        for (int sequence = 1; Files.exists(candidate); sequence++) {
            candidate = directory.resolve(base + "_" + sequence + EXTENSION);
        }
        return candidate;
    }

    public static boolean isBackupOf(DatabaseType type, String fileName) {
        return pattern(type).matcher(fileName).matches();
    }

    /**
     * Finds the newest backup of {@code type} in {@code directory}.
     */
    public static Optional<Path> findLatestBackup(Path directory, DatabaseType type) throws IOException {
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        Pattern pattern = pattern(type);
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(file -> pattern.matcher(file.getFileName().toString()).matches())
                .max(Comparator.comparing((Path file) -> timestampOf(pattern, file))
                    .thenComparingInt(file -> sequenceOf(pattern, file)));
        }
    }

    private static String timestampOf(Pattern pattern, Path file) {
        Matcher matcher = pattern.matcher(file.getFileName().toString());
        return matcher.matches() ? matcher.group(1) : "";
    }

    private static int sequenceOf(Pattern pattern, Path file) {
        Matcher matcher = pattern.matcher(file.getFileName().toString());
        if (!matcher.matches() || matcher.group(2) == null) {
            return 0;
        }
        return Integer.parseInt(matcher.group(2));
    }

    private static Pattern pattern(DatabaseType type) {
        return Pattern.compile(Pattern.quote(type.logicalName()) + "_(\\d{8}_\\d{6}_\\d{3})(?:_(\\d{1,9}))?\\.db");
    }
}
