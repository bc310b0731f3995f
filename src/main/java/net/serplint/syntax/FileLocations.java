// Copyright 2026 The Serplint Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.serplint.syntax;

import java.util.Arrays;

/**
 * FileLocations maps char offsets within a file to line numbers, columns, and Serpent {@link
 * Position}s.
 */
final class FileLocations {

  private final int[] linestart; // maps line number (0-based) to offset of start of line
  private final int[] indentation; // maps line number to count of leading blank chars
  private final String file;
  private final int size; // size of file in chars

  private FileLocations(int[] linestart, int[] indentation, String file, int size) {
    this.linestart = linestart;
    this.indentation = indentation;
    this.file = file;
    this.size = size;
  }

  static FileLocations create(char[] buffer, String file) {
    int[] linestart = new int[8];
    int[] indentation = new int[8];
    int lines = 0;
    int i = 0;
    while (true) {
      if (lines == linestart.length) {
        linestart = Arrays.copyOf(linestart, lines * 2);
        indentation = Arrays.copyOf(indentation, lines * 2);
      }
      linestart[lines] = i;
      int indent = 0;
      while (i + indent < buffer.length
          && (buffer[i + indent] == ' '
              || buffer[i + indent] == '\t'
              || buffer[i + indent] == '\r')) {
        indent++;
      }
      indentation[lines] = indent;
      lines++;
      while (i < buffer.length && buffer[i] != '\n') {
        i++;
      }
      if (i == buffer.length) {
        break;
      }
      i++; // skip '\n'
    }
    return new FileLocations(
        Arrays.copyOf(linestart, lines), Arrays.copyOf(indentation, lines), file, buffer.length);
  }

  String file() {
    return file;
  }

  /** Returns the 0-based line containing the given offset. */
  int line(int offset) {
    if (offset < 0) {
      offset = 0;
    } else if (offset > size) {
      offset = size;
    }
    int i = Arrays.binarySearch(linestart, offset);
    if (i < 0) {
      i = -i - 2; // insertion point minus one
    }
    return i;
  }

  /** Returns the 0-based column of the given offset. */
  int column(int offset) {
    return Math.max(0, Math.min(offset, size) - linestart[line(offset)]);
  }

  /** Returns the number of leading blank characters on the given 0-based line. */
  int indentation(int line) {
    return line >= 0 && line < indentation.length ? indentation[line] : 0;
  }

  /** Returns the Serpent position of an offset: its column is relative to the indentation. */
  Position getPosition(int offset) {
    int line = line(offset);
    return Position.of(line, Math.max(0, column(offset) - indentation[line]));
  }
}
