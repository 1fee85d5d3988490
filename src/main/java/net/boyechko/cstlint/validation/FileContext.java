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
package net.boyechko.cstlint.validation;

import java.nio.file.Path;
import java.util.Objects;

/**
 * What a rule may know about a file before it is parsed.
 *
 * @param path path of the file as given to the engine
 * @param testFile whether the path falls under a configured test location
 */
public record FileContext(Path path, boolean testFile) {

    public FileContext {
        Objects.requireNonNull(path, "path");
    }

    public static FileContext of(String path) {
        return new FileContext(Path.of(path), false);
    }

    public String fileName() {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
