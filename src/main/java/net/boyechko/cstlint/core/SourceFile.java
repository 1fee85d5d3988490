/*
 * CST-Lint - Lint Engine over a Lossless Concrete Syntax Tree
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.cstlint.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** A file's path together with its full text. */
public record SourceFile(Path path, String source) {

    public SourceFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(source, "source");
    }

    public static SourceFile of(String path, String source) {
        return new SourceFile(Path.of(path), source);
    }

    public static SourceFile read(Path path) throws IOException {
        return new SourceFile(path, Files.readString(path, StandardCharsets.UTF_8));
    }
}
