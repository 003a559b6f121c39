/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.leadmind.filesystem.utils;


import com.phonepe.leadmind.core.errors.UnavailableError;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Ensures that the provided path exists and is a readable directory. If the path does not exist and
     * createIfNotExists is true, it will attempt to create the directory.
     *
     * @param path              The path to check or create.
     * @param createIfNotExists Whether to create the directory if it does not exist.
     * @param writeCheck        Whether to check for write permissions on the directory.
     * @return The absolute, normalized Path object representing the directory.
     * @throws IllegalArgumentException If the path is invalid, does not have the required permissions, or cannot be
     *                                  created when requested.
     */
    public static Path ensurePath(String path, boolean createIfNotExists, boolean writeCheck) {
        final var absolutePath = Path.of(path).toAbsolutePath().normalize();
        if (Files.exists(absolutePath)) {
            if (!Files.isDirectory(absolutePath)
                    || !Files.isReadable(absolutePath)
                    || (writeCheck && !Files.isWritable(absolutePath))) {
                throw new IllegalArgumentException(
                        "Sanity check for %s failed. Please check it exists and has the required permissions"
                                .formatted(absolutePath));
            }
        }
        else if (createIfNotExists) {
            try {
                Files.createDirectories(absolutePath);
            }
            catch (IOException e) {
                throw new IllegalArgumentException("Failed to create directory: " + absolutePath, e);
            }
        }
        else {
            throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
        }
        return absolutePath;
    }

    /**
     * Writes data next to the target and moves it into place, so readers see either the old or the new content.
     * Failures are reported as {@link UnavailableError} so callers can retry them.
     *
     * @param filePath The path of the file to write to.
     * @param data     The byte array data to write.
     */
    public static void writeAtomically(Path filePath, byte[] data) {
        final var tempFile = filePath.resolveSibling(filePath.getFileName() + ".tmp");
        try {
            Files.write(tempFile, data,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.SYNC);
            try {
                Files.move(tempFile, filePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            }
            catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}. Falling back to replace", filePath);
                Files.move(tempFile, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        catch (IOException e) {
            throw new UnavailableError("Could not write " + filePath, e);
        }
    }
}
