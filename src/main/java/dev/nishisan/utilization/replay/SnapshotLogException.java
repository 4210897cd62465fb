/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.utilization.replay;

import java.io.IOException;
import java.io.Serial;
import java.nio.file.Path;

/**
 * Raised when a snapshot log holds a frame that cannot be decoded.
 */
public class SnapshotLogException extends IOException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final transient Path path;
    private final long offset;

    public SnapshotLogException(Path path, long offset, String message) {
        super(message + " (" + path + " @ " + offset + ")");
        this.path = path;
        this.offset = offset;
    }

    public SnapshotLogException(Path path, long offset, String message, Throwable cause) {
        super(message + " (" + path + " @ " + offset + ")", cause);
        this.path = path;
        this.offset = offset;
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return the byte offset of the frame that failed
     */
    public long getOffset() {
        return offset;
    }
}
